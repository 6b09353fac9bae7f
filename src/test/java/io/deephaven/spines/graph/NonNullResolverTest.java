package io.deephaven.spines.graph;

import io.deephaven.spines.SpineSpecs;
import io.deephaven.spines.testutil.SpineTestUtil;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class NonNullResolverTest {
    private static final SpineSpecs RESOLVING = SpineSpecs.builder().resolveNonNullTokens(true).build();

    @Test
    public void nullBetweenNotes() {
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.SIMPLE);
        assertThat(document.isNonNullResolved()).isTrue();
        final Token first = document.token(1, 0);
        final Token nullToken = document.token(2, 0);
        final Token second = document.token(3, 0);
        assertThat(nullToken.previousNonNullTokens()).containsExactly(first);
        assertThat(nullToken.nextNonNullTokens()).containsExactly(second);
        assertThat(first.previousNonNullTokens()).isEmpty();
        assertThat(first.nextNonNullTokens()).containsExactly(second);
        assertThat(second.previousNonNullTokens()).containsExactly(first);
        assertThat(second.nextNonNullTokens()).isEmpty();
        // Only data tokens are annotated.
        assertThat(document.token(0, 0).nextNonNullTokens()).isEmpty();
        assertThat(document.token(4, 0).previousNonNullTokens()).isEmpty();
    }

    @Test
    public void notResolvedUnlessAsked() {
        final Document document = SpineTestUtil.read(SpineTestUtil.SIMPLE);
        assertThat(document.isNonNullResolved()).isFalse();
        assertThat(document.token(2, 0).previousNonNullTokens()).isEmpty();
        assertThat(document.resolveNonNullTokens()).isTrue();
        assertThat(document.isNonNullResolved()).isTrue();
        assertThat(document.token(2, 0).previousNonNullTokens()).containsExactly(document.token(1, 0));
    }

    @Test
    public void idempotent() {
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.WITH_GLOBALS);
        final List<List<Token>> before = snapshot(document);
        assertThat(document.resolveNonNullTokens()).isTrue();
        assertThat(snapshot(document)).isEqualTo(before);
    }

    @Test
    public void splitAndMerge() {
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.lines(
                "**kern",
                "4c",
                "*^",
                ".\t4e",
                ".\t.",
                "*v\t*v",
                ".",
                "4g",
                "*-"));
        assertThat(document.isValid()).isTrue();
        final Token c = document.token(1, 0);
        final Token e = document.token(3, 1);
        final Token g = document.token(7, 0);

        assertThat(document.token(3, 0).previousNonNullTokens()).containsExactly(c);
        assertThat(document.token(4, 1).previousNonNullTokens()).containsExactly(e);
        // Both branches reach the null after the merge.
        assertThat(document.token(6, 0).previousNonNullTokens()).containsExactlyInAnyOrder(c, e);
        assertThat(g.previousNonNullTokens()).containsExactlyInAnyOrder(c, e);

        assertThat(document.token(6, 0).nextNonNullTokens()).containsExactly(g);
        assertThat(e.nextNonNullTokens()).containsExactly(g);
        assertThat(c.nextNonNullTokens()).containsExactlyInAnyOrder(e, g);
    }

    @Test
    public void mergedBranchesDoNotDuplicate() {
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.lines(
                "**kern",
                "4c",
                "*^",
                ".\t.",
                "*v\t*v",
                "4d",
                "*-"));
        assertThat(document.token(5, 0).previousNonNullTokens()).containsExactly(document.token(1, 0));
        assertThat(document.token(1, 0).nextNonNullTokens()).containsExactly(document.token(5, 0));
    }

    @Test
    public void independentTracks() {
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.lines(
                "**kern\t**dynam",
                "4c\tp",
                ".\t.",
                "4d\tf",
                "*-\t*-"));
        assertThat(document.token(2, 0).previousNonNullTokens()).containsExactly(document.token(1, 0));
        assertThat(document.token(2, 1).previousNonNullTokens()).containsExactly(document.token(1, 1));
        assertThat(document.token(2, 1).nextNonNullTokens()).containsExactly(document.token(3, 1));
    }

    @Test
    public void openSpineResolvesBackward() {
        final SpineSpecs specs = SpineSpecs.builder().requireTerminators(false).resolveNonNullTokens(true).build();
        final Document document = SpineTestUtil.read(specs, SpineTestUtil.lines("**kern", "4c", ".", "4d"));
        assertThat(document.isValid()).isTrue();
        assertThat(document.token(2, 0).previousNonNullTokens()).containsExactly(document.token(1, 0));
        assertThat(document.token(2, 0).nextNonNullTokens()).containsExactly(document.token(3, 0));
        assertThat(document.token(1, 0).nextNonNullTokens()).containsExactly(document.token(3, 0));
    }

    @Test
    public void openAndTerminatedBranches() {
        final SpineSpecs specs = SpineSpecs.builder().requireTerminators(false).resolveNonNullTokens(true).build();
        final Document document = SpineTestUtil.read(specs, SpineTestUtil.lines(
                "**kern",
                "4c",
                "*^",
                ".\t.",
                "*-\t*",
                "4e"));
        assertThat(document.isValid()).isTrue();
        assertThat(document.trackEndCount(1)).isEqualTo(1);
        assertThat(document.token(3, 1).nextNonNullTokens()).containsExactly(document.token(5, 0));
        assertThat(document.token(1, 0).nextNonNullTokens()).containsExactly(document.token(5, 0));
        assertThat(document.token(3, 0).nextNonNullTokens()).isEmpty();
    }

    @Test
    public void deeplyNestedBranches() {
        final int depth = 2000;
        final List<String> lines = new ArrayList<>();
        lines.add("**kern");
        lines.add("4c");
        for (int ii = 0; ii != depth; ++ii) {
            lines.add("*^");
            lines.add("4d\t4e");
            lines.add("*v\t*v");
        }
        lines.add(".");
        lines.add("*-");
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.lines(lines.toArray(new String[0])));
        assertThat(document.isValid()).isTrue();

        final Token lastNull = document.token(-2, 0);
        final Line lastBranches = document.line(document.lineCount() - 4);
        assertThat(lastNull.previousNonNullTokens())
                .containsExactlyInAnyOrder(lastBranches.token(0), lastBranches.token(1));
        assertThat(document.token(1, 0).nextNonNullTokens())
                .containsExactlyInAnyOrder(document.token(3, 0), document.token(3, 1));
    }

    @Test
    public void nullOnlyBranchCarriesEveryEarlierNote() {
        final int depth = 50;
        final List<String> lines = new ArrayList<>();
        lines.add("**kern");
        lines.add("4c");
        for (int ii = 0; ii != depth; ++ii) {
            lines.add("*^");
            lines.add("4d\t.");
            lines.add("*v\t*v");
            lines.add(".");
        }
        lines.add("*-");
        final Document document = SpineTestUtil.read(RESOLVING, SpineTestUtil.lines(lines.toArray(new String[0])));
        assertThat(document.isValid()).isTrue();
        // The right-hand branch is all nulls, so every earlier note is nearest along some path.
        assertThat(document.token(-2, 0).previousNonNullTokens()).hasSize(depth + 1);
    }

    private static List<List<Token>> snapshot(Document document) {
        final List<List<Token>> result = new ArrayList<>();
        for (Line line : document.lines()) {
            for (Token token : line.tokens()) {
                result.add(new ArrayList<>(token.previousNonNullTokens()));
                result.add(new ArrayList<>(token.nextNonNullTokens()));
            }
        }
        return result;
    }
}
