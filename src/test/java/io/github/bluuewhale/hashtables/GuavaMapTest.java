package io.github.bluuewhale.hashtables;

import com.google.common.collect.testing.MapTestSuiteBuilder;
import com.google.common.collect.testing.TestMapGenerator;
import com.google.common.collect.testing.TestStringMapGenerator;
import com.google.common.collect.testing.features.CollectionFeature;
import com.google.common.collect.testing.features.CollectionSize;
import com.google.common.collect.testing.features.MapFeature;
import junit.framework.Test;
import junit.framework.TestCase;
import junit.framework.TestSuite;
import org.jspecify.annotations.NullMarked;

import java.util.Map;
import java.util.function.Supplier;

@NullMarked
public final class GuavaMapTest extends TestCase {

    public static Test suite() {
        var suite = new TestSuite();
        suite.addTest(mapTest("ChainingHashTable", generator(ChainingHashTable::new)));
        suite.addTest(mapTest("LinearProbingHashTable", generator(LinearProbingHashTable::new)));
        suite.addTest(mapTest("QuadraticProbingHashTable", generator(QuadraticProbingHashTable::new)));
        return suite;
    }

    // null keys are rejected, so null entry queries throw NPE
    private static Test mapTest(String name, TestMapGenerator<?, ?> generator) {
        return MapTestSuiteBuilder
            .using(generator)
            .named(name)
            .withFeatures(
                CollectionSize.ANY,
                MapFeature.GENERAL_PURPOSE,
                MapFeature.ALLOWS_NULL_VALUES,
                CollectionFeature.NON_STANDARD_TOSTRING,
                CollectionFeature.SUPPORTS_ITERATOR_REMOVE)
            .createTestSuite();
    }

    private static TestStringMapGenerator generator(Supplier<Map<String, String>> supplier) {
        return new TestStringMapGenerator() {
            @Override protected Map<String, String> create(Map.Entry<String, String>[] entries) {
                Map<String, String> map = supplier.get();
                for (Map.Entry<String, String> entry : entries) {
                    map.put(entry.getKey(), entry.getValue());
                }
                return map;
            }
        };
    }
}
