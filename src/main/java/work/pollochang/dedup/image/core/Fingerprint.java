package work.pollochang.dedup.image.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 固定長度的位元向量指紋。
 * <p>
 * 第 i 個位元存放在 {@code words[i / 64]} 的第 {@code i % 64} 位。
 * 序列化為位元組時，第 k 個位元組包含位元 8k~8k+7，位元 8k+j 對應數值 2^j。
 * <p>
 * 判斷是否重複只能透過 {@link #distance(Fingerprint)}，{@link #equals(Object)} 僅供集合操作使用。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class Fingerprint {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int bitLength;
    private final long[] words;

    private Fingerprint(int bitLength, long[] words) {
        this.bitLength = bitLength;
        this.words = words;
    }

    /**
     * 由布林陣列建立指紋，索引 i 即位元 i。
     */
    public static Fingerprint fromBits(boolean[] bits) {
        Objects.requireNonNull(bits, "bits must not be null");
        checkLength(bits.length);
        long[] words = new long[wordCount(bits.length)];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                words[i >>> 6] |= 1L << (i & 63);
            }
        }
        return new Fingerprint(bits.length, words);
    }

    /**
     * 由 '0'/'1' 字串建立指紋，最左邊的字元為位元 0。
     */
    public static Fingerprint fromBinaryString(String binary) {
        Objects.requireNonNull(binary, "binary must not be null");
        boolean[] bits = new boolean[binary.length()];
        for (int i = 0; i < bits.length; i++) {
            char c = binary.charAt(i);
            if (c != '0' && c != '1') {
                throw new IllegalArgumentException("非法的二進位字元 '" + c + "' 位於索引 " + i);
            }
            bits[i] = c == '1';
        }
        return fromBits(bits);
    }

    /**
     * 由 {@link #toBytes()} 的輸出還原指紋。
     *
     * @param bytes     位元組內容
     * @param bitLength 指紋位元數
     */
    public static Fingerprint fromBytes(byte[] bytes, int bitLength) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        checkLength(bitLength);
        if (bytes.length != byteCount(bitLength)) {
            throw new IllegalArgumentException("位元組長度 " + bytes.length + " 與位元數 " + bitLength + " 不符");
        }
        long[] words = new long[wordCount(bitLength)];
        for (int k = 0; k < bytes.length; k++) {
            words[k >>> 3] |= (bytes[k] & 0xFFL) << ((k & 7) * 8);
        }
        // 超出位元數的部分一律歸零，避免影響距離計算
        int tail = bitLength & 63;
        if (tail != 0) {
            words[words.length - 1] &= (1L << tail) - 1;
        }
        return new Fingerprint(bitLength, words);
    }

    /**
     * 由 {@link #toHex()} 的輸出還原指紋。
     */
    public static Fingerprint fromHex(String hex, int bitLength) {
        Objects.requireNonNull(hex, "hex must not be null");
        if ((hex.length() & 1) != 0) {
            throw new IllegalArgumentException("十六進位字串長度必須為偶數: " + hex);
        }
        byte[] bytes = new byte[hex.length() / 2];
        for (int k = 0; k < bytes.length; k++) {
            int hi = Character.digit(hex.charAt(2 * k), 16);
            int lo = Character.digit(hex.charAt(2 * k + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("非法的十六進位字串: " + hex);
            }
            bytes[k] = (byte) ((hi << 4) | lo);
        }
        return fromBytes(bytes, bitLength);
    }

    public int bitLength() {
        return bitLength;
    }

    public boolean bit(int index) {
        if (index < 0 || index >= bitLength) {
            throw new IndexOutOfBoundsException("位元索引 " + index + " 超出範圍 0.." + (bitLength - 1));
        }
        return (words[index >>> 6] & (1L << (index & 63))) != 0;
    }

    /**
     * 取出 {@code [from, from + length)} 區段的位元，組成一個 long (最低位為 from)。
     *
     * @param length 1~64
     */
    public long bits(int from, int length) {
        if (length < 1 || length > 64 || from < 0 || from + length > bitLength) {
            throw new IndexOutOfBoundsException("區段 [" + from + ", " + (from + length) + ") 超出範圍 0.." + bitLength);
        }
        int word = from >>> 6;
        int offset = from & 63;
        long value = words[word] >>> offset;
        if (offset != 0 && offset + length > 64) {
            value |= words[word + 1] << (64 - offset);
        }
        return length == 64 ? value : value & ((1L << length) - 1);
    }

    /**
     * 漢明距離：兩個等長指紋之間不同位元的數量。
     *
     * @throws IllegalArgumentException 長度不同時
     */
    public int distance(Fingerprint other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.bitLength != bitLength) {
            throw new IllegalArgumentException("無法比較不同長度的指紋: " + bitLength + " 與 " + other.bitLength);
        }
        int diff = 0;
        for (int i = 0; i < words.length; i++) {
            diff += Long.bitCount(words[i] ^ other.words[i]);
        }
        return diff;
    }

    public byte[] toBytes() {
        byte[] out = new byte[byteCount(bitLength)];
        for (int k = 0; k < out.length; k++) {
            out[k] = (byte) (words[k >>> 3] >>> ((k & 7) * 8));
        }
        return out;
    }

    public String toHex() {
        byte[] bytes = toBytes();
        char[] out = new char[bytes.length * 2];
        for (int k = 0; k < bytes.length; k++) {
            out[2 * k] = HEX[(bytes[k] >>> 4) & 0xF];
            out[2 * k + 1] = HEX[bytes[k] & 0xF];
        }
        return new String(out);
    }

    public String toBinaryString() {
        StringBuilder sb = new StringBuilder(bitLength);
        for (int i = 0; i < bitLength; i++) {
            sb.append(bit(i) ? '1' : '0');
        }
        return sb.toString();
    }

    private static void checkLength(int bitLength) {
        if (bitLength < 1) {
            throw new IllegalArgumentException("指紋長度必須至少 1 位元: " + bitLength);
        }
    }

    private static int wordCount(int bitLength) {
        return (bitLength + 63) >>> 6;
    }

    private static int byteCount(int bitLength) {
        return (bitLength + 7) >>> 3;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        Fingerprint other = (Fingerprint) o;
        return bitLength == other.bitLength && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * bitLength + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "Fingerprint[" + bitLength + " bits, " + toHex() + "]";
    }
}
