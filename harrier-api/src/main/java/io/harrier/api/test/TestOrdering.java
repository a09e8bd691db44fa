package io.harrier.api.test;

import java.util.Objects;

/**
 * Ordering metadata of a test. Ordered tests sharing a module key run one at a
 * time, in ascending source rank, within each project.
 */
public final class TestOrdering {

    private static final TestOrdering UNORDERED = new TestOrdering(null, -1);

    private final String moduleKey;
    private final long sourceRank;

    private TestOrdering(String moduleKey, long sourceRank) {
        this.moduleKey = moduleKey;
        this.sourceRank = sourceRank;
    }

    public static TestOrdering unordered() {
        return UNORDERED;
    }

    public static TestOrdering ordered(String moduleKey, long sourceRank) {
        return new TestOrdering(Objects.requireNonNull(moduleKey, "moduleKey"), sourceRank);
    }

    public boolean isOrdered() {
        return moduleKey != null;
    }

    /**
     * @return the module key, or {@code null} when unordered
     */
    public String moduleKey() {
        return moduleKey;
    }

    public long sourceRank() {
        return sourceRank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestOrdering)) return false;
        TestOrdering that = (TestOrdering) o;
        return sourceRank == that.sourceRank && Objects.equals(moduleKey, that.moduleKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleKey, sourceRank);
    }

    @Override
    public String toString() {
        return isOrdered() ? "Ordered{" + moduleKey + ", rank=" + sourceRank + "}" : "Unordered";
    }
}
