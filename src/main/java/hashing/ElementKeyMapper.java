package hashing;

import org.apache.commons.codec.digest.MurmurHash3;

import java.nio.charset.StandardCharsets;
import java.util.function.ToLongFunction;

/**
 * Maps sequence elements to the 64-bit values fed into the polynomial rolling hash.
 *
 * Characters map to their UTF-16 code unit and integral numbers to their value, so text
 * hashes exactly like the classic {@code ord()}-based formulation. Strings (e.g. word
 * tokens) go through Apache Commons Codec MurmurHash3 and anything else through a
 * finalised {@code hashCode()}. Equal elements always map to equal values; the converse
 * does not hold, which is why every rolling-hash hit is verified.
 */
public final class ElementKeyMapper implements ToLongFunction<Object> {

    public static final ElementKeyMapper DEFAULT = new ElementKeyMapper();

    private ElementKeyMapper() {
    }

    @Override
    public long applyAsLong(Object element) {
        if (element == null) {
            return 0L;
        }
        if (element instanceof Character) {
            return (Character) element;
        }
        if (element instanceof Integer || element instanceof Long
                || element instanceof Short || element instanceof Byte) {
            return ((Number) element).longValue();
        }
        if (element instanceof CharSequence) {
            // hash128 then fold to one 64-bit word
            byte[] bytes = element.toString().getBytes(StandardCharsets.UTF_8);
            long[] hh = MurmurHash3.hash128x64(bytes);
            return hh[0] ^ hh[1];
        }
        return mix(element.hashCode());
    }

    private static long mix(long z) {
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        z *= 0xc4ceb9fe1a85ec53L;
        z ^= (z >>> 33);
        return z;
    }
}
