package com.flagged.core;

import com.flagged.error.ErrorType;
import com.flagged.error.FlagException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.*;

class FlagSetBuilderTest {

    @Test
    void shouldDeclareLiteralFlagsInOrder() throws FlagException {
        var flags = FlagSet.builder("MyEnum")
            .flag("read_only", 1 << 0)
            .flag("lowercase", 1 << 1)
            .flag("immediate", 1 << 2)
            .build();

        assertThat(flags.getName()).isEqualTo("MyEnum");
        assertThat(flags).extracting(Flag::getName).containsExactly("read_only", "lowercase", "immediate");
        assertThat(flags).extracting(Flag::getValue).containsExactly(1L, 2L, 4L);
    }

    @Test
    void shouldAssignAutoValuesInDeclarationOrder() throws FlagException {
        var flags = FlagSet.builder("MyAutoEnum")
            .auto("read_only")
            .auto("lowercase")
            .auto("immediate")
            .build();

        assertThat(flags).extracting(Flag::getValue).containsExactly(1L, 2L, 4L);
    }

    @Test
    void shouldReserveAllLiteralsBeforeResolvingAutoMarkers() throws FlagException {
        var flags = FlagSet.builder("Mixed")
            .auto("first")
            .flag("one", 1)
            .auto("second")
            .flag("four", 4)
            .build();

        assertThat(flags.get("first").getValue()).isEqualTo(2L);
        assertThat(flags.get("second").getValue()).isEqualTo(8L);
        assertThat(flags).extracting(Flag::getName).containsExactly("first", "one", "second", "four");
        assertThat(flags.mask()).isEqualTo(15L);
    }

    @Test
    void shouldAcceptRawIntegralValues() throws FlagException {
        var flags = FlagSet.builder("Raw")
            .declare("b", (byte) 1)
            .declare("s", (short) 2)
            .declare("i", 4)
            .declare("l", 8L)
            .declare("big", BigInteger.valueOf(16))
            .declare("auto", FlagSet.AUTO)
            .build();

        assertThat(flags).extracting(Flag::getValue).containsExactly(1L, 2L, 4L, 8L, 16L, 32L);
    }

    @Test
    void shouldRejectNonIntegerValue() {
        assertThatThrownBy(() -> FlagSet.builder("Bad").declare("text", "1").build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType", "flagName")
            .containsExactly(ErrorType.ILLEGAL_FLAG_VALUE, "text");

        assertThatThrownBy(() -> FlagSet.builder("Bad").declare("real", 1.0).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.ILLEGAL_FLAG_VALUE);

        assertThatThrownBy(() -> FlagSet.builder("Bad").declare("none", null).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.ILLEGAL_FLAG_VALUE);
    }

    @Test
    void shouldRejectNegativeAndOversizedValues() {
        assertThatThrownBy(() -> FlagSet.builder("Bad").flag("negative", -1).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.ILLEGAL_FLAG_VALUE);

        assertThatThrownBy(() -> FlagSet.builder("Bad").declare("huge", BigInteger.ONE.shiftLeft(64)).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.ILLEGAL_FLAG_VALUE);
    }

    @Test
    void shouldRejectIdenticalLiteralValues() {
        assertThatThrownBy(() -> FlagSet.builder("MyClashingFlagsEnum")
                .flag("read_only", 1)
                .flag("lowercase", 1)
                .build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType", "flagName")
            .containsExactly(ErrorType.REPEATED_FLAG_VALUE, "lowercase");
    }

    @Test
    void shouldRejectOverlappingLiteralValues() {
        assertThatThrownBy(() -> FlagSet.builder("Overlap")
                .flag("low", 3)
                .flag("mid", 6)
                .build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType", "flagName")
            .containsExactly(ErrorType.REPEATED_FLAG_VALUE, "mid");
    }

    @Test
    void shouldAllowOneZeroFlagOnly() throws FlagException {
        var flags = FlagSet.builder("WithNone").flag("none", 0).auto("some").build();
        assertThat(flags.get("none").getValue()).isZero();
        assertThat(flags.get("some").getValue()).isEqualTo(1L);

        assertThatThrownBy(() -> FlagSet.builder("TwoNones").flag("none", 0).flag("nothing", 0).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.REPEATED_FLAG_VALUE);
    }

    @Test
    void shouldSkipPrivateNamesAndBehaviour() throws FlagException {
        Supplier<Integer> supplier = () -> 2;
        Callable<Integer> callable = () -> 4;
        Runnable runnable = () -> { };

        var flags = FlagSet.builder("Filtered")
            .flag("_internal", 1)
            .declare("supplier", supplier)
            .declare("callable", callable)
            .declare("runnable", runnable)
            .auto("real")
            .build();

        assertThat(flags).extracting(Flag::getName).containsExactly("real");
        assertThat(flags.get("real").getValue()).isEqualTo(1L);
        assertThat(flags.findByName("_internal")).isEmpty();
        assertThat(flags.findByName("supplier")).isEmpty();
    }

    @Test
    void shouldSkipEveryKindOfFunctionalValue() throws FlagException {
        Function<Integer, Integer> function = x -> x;
        UnaryOperator<Integer> operator = x -> x;
        BiFunction<Integer, Integer, Integer> biFunction = Integer::sum;
        Consumer<Integer> consumer = x -> { };
        Predicate<Integer> predicate = x -> true;

        var flags = FlagSet.builder("Behaviour")
            .declare("function", function)
            .declare("operator", operator)
            .declare("bi_function", biFunction)
            .declare("consumer", consumer)
            .declare("predicate", predicate)
            .flag("only", 8)
            .build();

        assertThat(flags).extracting(Flag::getName).containsExactly("only");
    }

    @Test
    void shouldRejectInvalidAndDuplicateNames() {
        assertThatThrownBy(() -> FlagSet.builder("Names").flag("", 1).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.INVALID_FLAG_NAME);

        assertThatThrownBy(() -> FlagSet.builder("Names").flag("a|b", 1).build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.INVALID_FLAG_NAME);

        assertThatThrownBy(() -> FlagSet.builder("Names").flag("twice", 1).auto("twice").build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType", "flagName")
            .containsExactly(ErrorType.DUPLICATE_FLAG_NAME, "twice");
    }

    @Test
    void shouldFailWhenAutoValuesRunOut() {
        var builder = FlagSet.builder("Full").flag("almost_everything", Long.MAX_VALUE >>> 1);
        builder.auto("last_bit").auto("one_too_many");

        assertThatThrownBy(builder::build)
            .isInstanceOf(FlagException.class)
            .extracting("errorType")
            .isEqualTo(ErrorType.FLAG_SPACE_EXHAUSTED);
    }

    @Test
    void shouldUseCustomValueGenerator() throws FlagException {
        var flags = FlagSet.builder("HighBits")
            .valueGenerator(reserved -> new FlagValueGenerator() {
                private long next = 1L << 8;

                @Override
                public long next() {
                    long value = next;
                    next <<= 1;
                    return value;
                }

                @Override
                public long reserved() {
                    return reserved | (next - 1);
                }
            })
            .flag("low", 1)
            .auto("a")
            .auto("b")
            .build();

        assertThat(flags).extracting(Flag::getValue).containsExactly(1L, 256L, 512L);
    }

    @Test
    void shouldRejectCustomGeneratorThatCollides() {
        assertThatThrownBy(() -> FlagSet.builder("Colliding")
                .valueGenerator(reserved -> new FlagValueGenerator() {
                    @Override
                    public long next() {
                        return 1;
                    }

                    @Override
                    public long reserved() {
                        return reserved;
                    }
                })
                .flag("one", 1)
                .auto("also_one")
                .build())
            .isInstanceOf(FlagException.class)
            .extracting("errorType", "flagName")
            .containsExactly(ErrorType.REPEATED_FLAG_VALUE, "also_one");
    }
}
