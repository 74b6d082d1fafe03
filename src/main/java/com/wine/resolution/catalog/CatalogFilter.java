package com.wine.resolution.catalog;

import com.wine.resolution.core.model.CanonicalWineRecord;
import com.wine.resolution.core.model.DataSource;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Structured predicate over catalog records.
 * Stores may translate the tree into a native query; {@link #test} evaluates it in memory.
 */
public interface CatalogFilter {

    boolean test(CanonicalWineRecord record);

    /**
     * Exact equality on a field.
     */
    record Equals(CatalogField field, Object value) implements CatalogFilter {
        public Equals {
            Objects.requireNonNull(field, "field is required");
            Objects.requireNonNull(value, "value is required, use IsNull for absent values");
        }

        @Override
        public boolean test(CanonicalWineRecord record) {
            return value.equals(field.valueOf(record));
        }

        @Override
        public String toString() {
            return field.fieldName() + " = '" + value + "'";
        }
    }

    /**
     * Case-insensitive substring match on a text field.
     */
    record ContainsIgnoreCase(CatalogField field, String text) implements CatalogFilter {
        public ContainsIgnoreCase {
            Objects.requireNonNull(field, "field is required");
            if (text == null || text.isEmpty()) {
                throw new IllegalArgumentException("Substring filter on " + field + " needs a non-empty text");
            }
        }

        @Override
        public boolean test(CanonicalWineRecord record) {
            Object value = field.valueOf(record);
            return value != null
                    && value.toString().toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
        }

        @Override
        public String toString() {
            return field.fieldName() + " ~* '" + text + "'";
        }
    }

    record IsNull(CatalogField field) implements CatalogFilter {
        @Override
        public boolean test(CanonicalWineRecord record) {
            return field.valueOf(record) == null;
        }

        @Override
        public String toString() {
            return field.fieldName() + " IS NULL";
        }
    }

    record And(List<CatalogFilter> filters) implements CatalogFilter {
        public And {
            filters = List.copyOf(filters);
        }

        @Override
        public boolean test(CanonicalWineRecord record) {
            return filters.stream().allMatch(f -> f.test(record));
        }

        @Override
        public String toString() {
            return filters.stream().map(Object::toString).collect(Collectors.joining(" AND ", "(", ")"));
        }
    }

    record Or(List<CatalogFilter> filters) implements CatalogFilter {
        public Or {
            if (filters.isEmpty()) {
                throw new IllegalArgumentException("OR filter needs at least one branch");
            }
            filters = List.copyOf(filters);
        }

        @Override
        public boolean test(CanonicalWineRecord record) {
            return filters.stream().anyMatch(f -> f.test(record));
        }

        @Override
        public String toString() {
            return filters.stream().map(Object::toString).collect(Collectors.joining(" OR ", "(", ")"));
        }
    }

    static CatalogFilter eq(CatalogField field, Object value) {
        return new Equals(field, value);
    }

    static CatalogFilter containsIgnoreCase(CatalogField field, String text) {
        return new ContainsIgnoreCase(field, text);
    }

    static CatalogFilter isNull(CatalogField field) {
        return new IsNull(field);
    }

    static CatalogFilter and(CatalogFilter... filters) {
        return new And(List.of(filters));
    }

    static CatalogFilter and(List<CatalogFilter> filters) {
        return new And(filters);
    }

    static CatalogFilter or(List<CatalogFilter> filters) {
        return new Or(filters);
    }

    /**
     * Shared records only: user-owned copies are excluded.
     */
    static CatalogFilter canonical() {
        return isNull(CatalogField.OWNER);
    }

    /**
     * Shared records that came from the reference dataset: the resolution candidate pool.
     */
    static CatalogFilter catalogSourced() {
        return and(canonical(), eq(CatalogField.DATA_SOURCE, DataSource.CATALOG_IMPORT));
    }
}
