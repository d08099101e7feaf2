package com.ryuqq.audioedit.testkit.executor;

import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.catalog.OperationDescriptor;
import com.ryuqq.audioedit.core.catalog.StandardOperations;
import com.ryuqq.audioedit.core.executor.OperationExecutor;
import com.ryuqq.audioedit.core.model.OperationKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Catalogs with the standard descriptors bound to test executors.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class TestCatalogs {

    private TestCatalogs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Every standard operation bound to a pass-through executor, except the given overrides.
     *
     * @param overrides executors replacing the pass-through for their kind
     * @return populated catalog
     */
    public static OperationCatalog passThrough(OperationExecutor... overrides) {
        Map<OperationKind, OperationExecutor> byKind = new EnumMap<>(OperationKind.class);
        for (OperationExecutor override : overrides) {
            byKind.put(override.kind(), override);
        }
        OperationCatalog catalog = new OperationCatalog();
        for (OperationDescriptor descriptor : StandardOperations.all()) {
            OperationExecutor executor = byKind.getOrDefault(descriptor.kind(),
                ScriptedOperationExecutor.passThrough(descriptor.kind()));
            catalog.register(descriptor, executor);
        }
        return catalog;
    }
}
