package com.codescan.core.provider;

/**
 * Adapter that never contacts a provider and reports no findings.
 *
 * <p>Used for rules-only scans, where findings come from the pattern match engine alone.
 */
public final class NoOpAnalysisAdapter implements AnalysisAdapter {

    public static final NoOpAnalysisAdapter INSTANCE = new NoOpAnalysisAdapter();

    private NoOpAnalysisAdapter() {
    }

    @Override
    public String analyze(String prompt) {
        return "[]";
    }
}
