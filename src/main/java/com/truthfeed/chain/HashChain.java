package com.truthfeed.chain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;

/**
 * SHA-256 hash-chain primitives shared by event feeds and integrity chains.
 *
 * All functions are pure: identical inputs always produce identical output.
 */
public final class HashChain {

    /** Predecessor hash of the first record in any chain. */
    public static final String GENESIS =
        "0000000000000000000000000000000000000000000000000000000000000000";

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashChain() {
    }

    /**
     * Hashes the canonical JSON encoding of {@code body}.
     *
     * @throws NonCanonicalPayloadException if the body has no canonical encoding
     */
    public static String linkHash(Object body) {
        return sha256Hex(CanonicalJson.encode(body));
    }

    /**
     * Links {@code proof} to its predecessor. Swapping the arguments yields a
     * different link.
     */
    public static String chainHash(String proof, String previousProof) {
        if (proof == null || previousProof == null) {
            throw new IllegalArgumentException("proof and previousProof are required");
        }
        return sha256Hex(previousProof + ":" + proof);
    }

    /**
     * Balanced pairwise reduction. An odd level duplicates its last hash; a
     * single hash is its own root; an empty list yields {@link #GENESIS}.
     */
    public static String merkleRoot(List<String> hashes) {
        if (hashes.isEmpty()) {
            return GENESIS;
        }
        List<String> level = new ArrayList<>(hashes);
        while (level.size() > 1) {
            List<String> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                next.add(sha256Hex(left + right));
            }
            level = next;
        }
        return level.get(0);
    }

    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
