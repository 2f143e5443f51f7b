package com.bassline.core.gadget.primitives;

import static com.bassline.core.gadget.primitives.Ports.number;
import static com.bassline.core.gadget.primitives.Ports.out;

import com.bassline.core.gadget.GadgetRegistry;
import com.bassline.core.gadget.GadgetSpec;

import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Arithmetic over number contacts. Binary gadgets read {@code a} and
 * {@code b}; unary gadgets read {@code value} and write {@code result}.
 */
public final class MathGadgets {
    static final String CATEGORY = "math";

    private MathGadgets() {
    }

    public static void register(GadgetRegistry registry) {
        registry.register(binary("add", "sum", "Adds two numbers", Double::sum));
        registry.register(binary("subtract", "difference", "Subtracts b from a", (a, b) -> a - b));
        registry.register(binary("multiply", "product", "Multiplies two numbers", (a, b) -> a * b));
        registry.register(binary("min", "result", "Smaller of two numbers", Math::min));
        registry.register(binary("max", "result", "Larger of two numbers", Math::max));

        // Division by zero leaves the quotient unset.
        registry.register(GadgetSpec.strict("divide", CATEGORY, "Divides a by b", List.of("a", "b"),
                List.of("quotient"), in -> {
                    double divisor = number(in, "b");
                    if (divisor == 0.0)
                        return Map.of();
                    return out("quotient", number(in, "a") / divisor);
                }));

        registry.register(unary("negate", "Negates a number", x -> -x));
        registry.register(unary("abs", "Absolute value", Math::abs));
        registry.register(GadgetSpec.strict("sqrt", CATEGORY, "Square root of a non-negative number",
                List.of("value"), List.of("result"), in -> {
                    double x = number(in, "value");
                    if (x < 0)
                        throw new IllegalArgumentException("sqrt of negative number " + x);
                    return out("result", Math.sqrt(x));
                }));
    }

    private static GadgetSpec binary(String id, String output, String description, DoubleBinaryOperator op) {
        return GadgetSpec.strict(id, CATEGORY, description, List.of("a", "b"), List.of(output),
                in -> out(output, op.applyAsDouble(number(in, "a"), number(in, "b"))));
    }

    private static GadgetSpec unary(String id, String description, DoubleUnaryOperator op) {
        return GadgetSpec.strict(id, CATEGORY, description, List.of("value"), List.of("result"),
                in -> out("result", op.applyAsDouble(number(in, "value"))));
    }
}
