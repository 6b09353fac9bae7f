package io.deephaven.spines.graph;

import io.deephaven.spines.SpineSpecs;
import io.deephaven.spines.util.ErrorKind;
import io.deephaven.spines.util.ErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

public class SpineStateTest {
    private final Document document = new Document(SpineSpecs.tsv());
    private final TrackRegistry.Builder registry = new TrackRegistry.Builder();
    private final List<ErrorKind> errors = new ArrayList<>();
    private final ErrorReporter reporter = (kind, lineIndex, message) -> {
        errors.add(kind);
        return false;
    };

    @BeforeEach
    public void registerTwoTracks() {
        final Line exclusive = document.append("**kern\t**dynam");
        registry.registerStart(exclusive.token(0));
        registry.registerStart(exclusive.token(1));
    }

    @Test
    public void split() {
        final SpineState next = state("1", "2").next(document.append("*^\t*"), registry, reporter);
        assertThat(next).isNotNull();
        assertThat(next.pathLabels()).containsExactly("(1)a", "(1)b", "2");
        assertThat(next.dataType(1)).isEqualTo("**kern");
        assertThat(next.dataType(2)).isEqualTo("**dynam");
    }

    @Test
    public void mergeUndoesSplit() {
        final SpineState next = state("(1)a", "(1)b", "2").next(document.append("*v\t*v\t*"), registry, reporter);
        assertThat(next).isNotNull();
        assertThat(next.pathLabels()).containsExactly("1", "2");
    }

    @Test
    public void threeWayMerge() {
        final SpineState next = state("((1)a)a", "((1)a)b", "(1)b")
                .next(document.append("*v\t*v\t*v"), registry, reporter);
        assertThat(next).isNotNull();
        assertThat(next.pathLabels()).containsExactly("((1)a)a ((1)a)b (1)b");
    }

    @Test
    public void loneMerge() {
        assertThat(state("1", "2").next(document.append("*v\t*"), registry, reporter)).isNull();
        assertThat(errors).containsExactly(ErrorKind.MALFORMED_MANIPULATOR);
    }

    @Test
    public void exchange() {
        final SpineState next = state("1", "2").next(document.append("*x\t*x"), registry, reporter);
        assertThat(next).isNotNull();
        assertThat(next.pathLabels()).containsExactly("2", "1");
        assertThat(next.dataType(0)).isEqualTo("**dynam");
        assertThat(next.dataType(1)).isEqualTo("**kern");
    }

    @Test
    public void loneExchange() {
        assertThat(state("1", "2").next(document.append("*\t*x"), registry, reporter)).isNull();
        assertThat(errors).containsExactly(ErrorKind.MALFORMED_MANIPULATOR);
    }

    @Test
    public void addThenExclusive() {
        final SpineState added = state("1", "2").next(document.append("*+\t*"), registry, reporter);
        assertThat(added).isNotNull();
        assertThat(added.pathLabels()).containsExactly("1", "3", "2");
        assertThat(added.dataType(1)).isEmpty();
        assertThat(registry.isPending(3)).isTrue();
        assertThat(registry.trackCount()).isEqualTo(3);

        final Line exclusive = document.append("*\t**text\t*");
        final SpineState bound = added.next(exclusive, registry, reporter);
        assertThat(bound).isNotNull();
        assertThat(bound.pathLabels()).containsExactly("1", "3", "2");
        assertThat(bound.dataType(1)).isEqualTo("**text");
        assertThat(registry.hasPending()).isFalse();
        assertThat(registry.build().startOf(3)).isSameAs(exclusive.token(1));
        assertThat(errors).isEmpty();
    }

    @Test
    public void exclusiveWithoutAdd() {
        assertThat(state("1", "2").next(document.append("**kern\t*"), registry, reporter)).isNull();
        assertThat(errors).containsExactly(ErrorKind.MALFORMED_MANIPULATOR);
    }

    @Test
    public void terminate() {
        final Line terminators = document.append("*-\t*-");
        final SpineState next = state("(1)b", "2").next(terminators, registry, reporter);
        assertThat(next).isNotNull();
        assertThat(next.size()).isZero();
        final TrackRegistry tracks = registry.build();
        assertThat(tracks.endOf(1, 0)).isSameAs(terminators.token(0));
        assertThat(tracks.endOf(2, 0)).isSameAs(terminators.token(1));
    }

    @Test
    public void wrongFieldCount() {
        assertThat(state("1", "2").next(document.append("*^"), registry, reporter)).isNull();
        assertThat(errors).containsExactly(ErrorKind.STRUCTURAL_DESYNC);
    }

    private static Stream<Arguments> provideMerges() {
        return Stream.of(
                Arguments.of(Arrays.asList("(1)a", "(1)b"), "1"),
                Arguments.of(Arrays.asList("(1)b", "(1)a"), "1"),
                Arguments.of(Arrays.asList("((2)a)a", "((2)a)b"), "(2)a"),
                Arguments.of(Arrays.asList("(1)a", "(2)b"), "(1)a (2)b"),
                Arguments.of(Arrays.asList("(1)a", "(1)a"), "(1)a (1)a"),
                Arguments.of(Arrays.asList("1", "2"), "1 2"),
                Arguments.of(Arrays.asList("(1)a", "(1)b", "2"), "(1)a (1)b 2"));
    }

    @ParameterizedTest
    @MethodSource("provideMerges")
    public void mergedLabel(List<String> labels, String expected) {
        assertThat(SpineState.mergedLabel(labels)).isEqualTo(expected);
    }

    @Test
    public void trackOf() {
        assertThat(SpineState.trackOf("1")).isEqualTo(1);
        assertThat(SpineState.trackOf("(12)a")).isEqualTo(12);
        assertThat(SpineState.trackOf("((3)b)a (4)a")).isEqualTo(3);
        assertThat(SpineState.trackOf("")).isZero();
    }

    private static SpineState state(String... labels) {
        final String[] types = new String[labels.length];
        for (int ii = 0; ii != labels.length; ++ii) {
            types[ii] = SpineState.trackOf(labels[ii]) == 1 ? "**kern" : "**dynam";
        }
        return new SpineState(types, labels);
    }
}
