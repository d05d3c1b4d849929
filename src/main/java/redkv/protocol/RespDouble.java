package redkv.protocol;

import io.netty.buffer.ByteBuf;
import java.math.BigDecimal;

/**
 * A 64-bit floating point frame.
 * <p>
 * Magnitudes within [1e-8, 1e8] are written in plain decimal notation, anything
 * else in exponential notation such as {@code +1.23456e8}. The integral part
 * always carries a sign. Infinities and NaN use the RESP3 words {@code inf},
 * {@code -inf} and {@code nan}.
 */
public final class RespDouble extends Frame {
    private static final double PLAIN_MIN = 1e-8;
    private static final double PLAIN_MAX = 1e8;

    private final double value;

    public RespDouble(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public FrameType getType() {
        return FrameType.DOUBLE;
    }

    @Override
    public void encode(ByteBuf out) {
        writeLine(out, FrameType.DOUBLE, format(value));
    }

    static String format(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";

        boolean negative = d < 0 || (d == 0 && 1 / d < 0);
        String sign = negative ? "-" : "+";
        double abs = Math.abs(d);
        if (abs > PLAIN_MAX || abs < PLAIN_MIN) {
            return sign + exponential(abs);
        }
        return sign + BigDecimal.valueOf(abs).stripTrailingZeros().toPlainString();
    }

    // shortest round-tripping digits as d.ddd e exp
    private static String exponential(double abs) {
        BigDecimal bd = BigDecimal.valueOf(abs).stripTrailingZeros();
        if (bd.signum() == 0) return "0e0";
        String digits = bd.unscaledValue().toString();
        int exponent = digits.length() - 1 - bd.scale();
        StringBuilder sb = new StringBuilder(digits.length() + 8);
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        return sb.append('e').append(exponent).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespDouble)) return false;
        return Double.compare(value, ((RespDouble) o).value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return "Double(" + value + ")";
    }
}
