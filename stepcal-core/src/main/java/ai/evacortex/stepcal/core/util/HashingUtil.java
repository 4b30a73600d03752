/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.util;

import ai.evacortex.stepcal.core.Profile;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("MD5 algorithm not available", e);
        }
    });

    private HashingUtil() {}

    /**
     * xxHash64 over the positions and values of both profiles and the step positions.
     * Identifies the snapshot a quality matrix was computed from.
     */
    public static long fingerprint(Profile calibration, Profile measurement, double[] steps) {
        int doubles = 2 * calibration.size() + 2 * measurement.size() + steps.length;
        ByteBuffer buffer = ByteBuffer.allocate(doubles * Double.BYTES + 3 * Integer.BYTES);
        putProfile(buffer, calibration);
        putProfile(buffer, measurement);
        buffer.putInt(steps.length);
        for (double s : steps) {
            buffer.putDouble(s);
        }
        byte[] bytes = buffer.array();
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    /**
     * MD5 hex over the given arrays, used as the content id of persisted records.
     */
    public static String computeContentHash(double[]... columns) {
        int total = 0;
        for (double[] c : columns) total += c.length;
        ByteBuffer buffer = ByteBuffer.allocate(total * Double.BYTES + columns.length * Integer.BYTES);
        for (double[] c : columns) {
            buffer.putInt(c.length);
            for (double v : c) buffer.putDouble(v);
        }
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        return HexFormat.of().formatHex(digest.digest(buffer.array()));
    }

    private static void putProfile(ByteBuffer buffer, Profile profile) {
        buffer.putInt(profile.size());
        for (int i = 0; i < profile.size(); i++) {
            buffer.putDouble(profile.xAt(i));
            buffer.putDouble(profile.yAt(i));
        }
    }
}
