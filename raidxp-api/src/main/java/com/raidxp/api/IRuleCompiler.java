package com.raidxp.api;

import com.raidxp.api.exceptions.CompilationException;
import com.raidxp.runtime.model.RuleSet;

import io.opentelemetry.api.trace.Tracer;

import java.io.IOException;
import java.nio.file.Path;

public interface IRuleCompiler {

    /**
     * Compiles a rule document (YAML or JSON).
     *
     * @param rulesPath path to the rule document
     * @return compiled rule set
     * @throws IOException          if the document cannot be read
     * @throws CompilationException if any pattern, award or quest seed is invalid
     */
    RuleSet compile(Path rulesPath) throws IOException, CompilationException;

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
