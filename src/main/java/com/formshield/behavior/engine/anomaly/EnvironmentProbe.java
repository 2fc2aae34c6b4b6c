package com.formshield.behavior.engine.anomaly;

import java.util.List;

/**
 * Host environment facts the automation checks read. In production these come from the
 * browser-side collaborator; tests supply them directly.
 * Dimension getters may return null when the host did not report them.
 */
public interface EnvironmentProbe {

    boolean isWebdriver();

    boolean isPhantom();

    String getUserAgent();

    List<String> getLanguages();

    Integer getInnerWidth();

    Integer getInnerHeight();

    Integer getOuterWidth();

    Integer getOuterHeight();
}
