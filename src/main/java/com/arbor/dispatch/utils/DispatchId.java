package com.arbor.dispatch.utils;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity of one publish, shared by its log lines and its span. Backed by a time-ordered (version 7) UUID so ids sort
 * by creation time. Renders as 32 lowercase hex characters.
 */
public record DispatchId(UUID uuid) {

	private static final SecureRandom RANDOM = new SecureRandom();

	public DispatchId {
		Objects.requireNonNull(uuid, "uuid");
	}

	public static DispatchId next() {
		byte[] bytes = new byte[16];
		RANDOM.nextBytes(bytes);
		long millis = System.currentTimeMillis();
		for (int i = 0; i < 6; i++) {
			bytes[i] = (byte) (millis >>> (40 - 8 * i));
		}
		bytes[6] = (byte) ((bytes[6] & 0x0F) | 0x70);
		bytes[8] = (byte) ((bytes[8] & 0x3F) | 0x80);
		ByteBuffer buf = ByteBuffer.wrap(bytes);
		return new DispatchId(new UUID(buf.getLong(), buf.getLong()));
	}

	/** Millisecond timestamp embedded in the id. */
	public Instant createdAt() {
		return Instant.ofEpochMilli(uuid.getMostSignificantBits() >>> 16);
	}

	@Override
	public String toString() {
		return uuid.toString().replace("-", "");
	}
}
