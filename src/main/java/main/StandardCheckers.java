package main;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import analysis.dataflow.Checker;
import analysis.dataflow.CheckerRegistry;
import analysis.dataflow.CheckerRegistry.CheckerFactory;
import analysis.dataflow.interprocedural.biabduction.BiAbductionConfig;
import analysis.dataflow.interprocedural.biabduction.BiAbductionDomain;
import analysis.dataflow.interprocedural.nonnull.NonNullDomain;

/**
 * Checkers shipped with the engine
 */
public final class StandardCheckers {

    public static final String BIABDUCTION = "biabduction";
    public static final String NONNULL = "nonnull";
    public static final List<String> NAMES = Collections.unmodifiableList(Arrays.asList(BIABDUCTION, NONNULL));

    private StandardCheckers() {
        // static methods only
    }

    /**
     * Registry with every standard checker
     *
     * @param config
     *            bounds for the bi-abduction domain
     * @return new registry
     */
    public static CheckerRegistry registry(final BiAbductionConfig config) {
        CheckerRegistry r = new CheckerRegistry();
        r.register(BIABDUCTION, new CheckerFactory() {
            @Override
            public Checker<?, ?> create() {
                return new Checker<>(BIABDUCTION, new BiAbductionDomain(config));
            }
        });
        r.register(NONNULL, new CheckerFactory() {
            @Override
            public Checker<?, ?> create() {
                return new Checker<>(NONNULL, new NonNullDomain());
            }
        });
        return r;
    }
}
