package com.sqlshaper.test;

import org.junit.jupiter.api.Tag;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Tag annotations used to select test subsets, for example
 * {@code mvn test -Dgroups=tier1}.
 */
public final class TestCategories {

    private TestCategories() {
    }

    /** Fast tests run on every build. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier1")
    public @interface Tier1 {
    }

    /** Broader scenario tests. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("tier2")
    public @interface Tier2 {
    }

    /** Tests of a single class. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("unit")
    public @interface Unit {
    }

    /** Tests running parse, edit and format together. */
    @Target({ElementType.TYPE, ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Tag("integration")
    public @interface Integration {
    }
}
