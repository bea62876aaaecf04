package uk.sky.pglock;

import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;

import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * Identifies a critical section on the arbiter.
 * <p>
 * PostgreSQL advisory locks are keyed by a {@code bigint}, so every name is reduced to a single
 * 64 bit key. String names use the first 8 bytes of their MD5 digest, which is the same value as
 * {@code ('x'||substr(md5(name),1,16))::bit(64)::bigint} computed on the server. Integer names are
 * used as they are.
 * <p>
 * Two names are equal when their keys are equal. A string name and an integer name only refer to
 * the same lock if the digest of the string happens to equal the integer, so pick one encoding for
 * each logical lock.
 */
public final class LockName {

    private final String name;
    private final long key;

    private LockName(String name, long key) {
        this.name = name;
        this.key = key;
    }

    /**
     * @param name application chosen name of the critical section
     * @return the lock name, keyed by the MD5 digest of {@code name}
     * @throws IllegalArgumentException if name is null or empty
     */
    @SuppressWarnings("deprecation")
    public static LockName of(String name) {
        checkArgument(!isNullOrEmpty(name), "Lock name must not be empty");
        byte[] digest = Hashing.md5().hashString(name, StandardCharsets.UTF_8).asBytes();
        return new LockName(name, Longs.fromByteArray(digest));
    }

    public static LockName of(long key) {
        return new LockName(Long.toString(key), key);
    }

    public String getName() {
        return name;
    }

    public long getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return key == ((LockName) o).key;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(key);
    }

    @Override
    public String toString() {
        return name;
    }
}
