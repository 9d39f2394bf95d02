package io.validator.core.protocol;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Hashes {
    private Hashes(){}
    public static byte[] sha256(byte[] in){
        try {
            return MessageDigest.getInstance("SHA-256").digest(in);
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    static String toHex(byte[] b){
        final char[] HEX="0123456789abcdef".toCharArray();
        char[] out=new char[b.length*2];
        for(int i=0,j=0;i<b.length;i++){int v=b[i]&0xff;out[j++]=HEX[v>>>4];out[j++]=HEX[v&0x0f];}
        return new String(out);
    }

    static byte[] fromHex(String hex, int expectedLength){
        if (hex == null) {
            throw new IllegalArgumentException("hex required");
        }
        String s = hex.startsWith("0x") ? hex.substring(2) : hex;
        if (s.length() != expectedLength * 2) {
            throw new IllegalArgumentException("Expected " + expectedLength + " bytes of hex, got: " + hex);
        }
        byte[] out = new byte[expectedLength];
        for (int i = 0; i < expectedLength; i++) {
            int hi = Character.digit(s.charAt(2 * i), 16);
            int lo = Character.digit(s.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Invalid hex: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }
}
