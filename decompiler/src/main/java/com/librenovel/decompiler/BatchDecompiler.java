package com.librenovel.decompiler;

import com.librenovel.ast.Block;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Decompiles many independent units on a worker pool.
 * Units share the decompiler configuration but no traversal state.
 */
public class BatchDecompiler implements AutoCloseable {

    private final ScriptDecompiler decompiler;
    private final ExecutorService executor;

    public BatchDecompiler(ScriptDecompiler decompiler, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        this.decompiler = decompiler;
        this.executor = Executors.newFixedThreadPool(threads);
    }

    /**
     * Outcome of one unit: either a result or the error that aborted it.
     */
    public record UnitResult(String unitName, DecompileResult result, DecompilerException error) {

        public static UnitResult success(String unitName, DecompileResult result) {
            return new UnitResult(unitName, result, null);
        }

        public static UnitResult failure(String unitName, DecompilerException error) {
            return new UnitResult(unitName, null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }

    /**
     * Decompile every unit and wait for all of them.
     *
     * @param units unit name to statement tree
     * @return results keyed by unit name, in the order of the input map
     */
    public Map<String, UnitResult> decompileAll(Map<String, Block> units) {
        Map<String, CompletableFuture<UnitResult>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, Block> unit : units.entrySet()) {
            futures.put(unit.getKey(),
                CompletableFuture.supplyAsync(() -> decompileUnit(unit.getKey(), unit.getValue()), executor));
        }

        Map<String, UnitResult> results = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<UnitResult>> future : futures.entrySet()) {
            results.put(future.getKey(), future.getValue().join());
        }
        return results;
    }

    private UnitResult decompileUnit(String name, Block ast) {
        try {
            return UnitResult.success(name, decompiler.decompile(ast));
        } catch (DecompilerException e) {
            System.err.println("[BatchDecompiler] Failed to decompile " + name + ": " + e.getMessage());
            return UnitResult.failure(name, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
