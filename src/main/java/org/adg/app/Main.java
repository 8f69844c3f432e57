package org.adg.app;

import lombok.extern.slf4j.Slf4j;
import org.adg.engine.DiagramEngine;
import org.adg.engine.GeneratedDiagram;
import org.adg.engine.GenerationResult;
import org.adg.expression.ExpressionTerm;
import org.adg.theory.Formalism;
import org.adg.theory.TheoryConfig;

import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 * <p>
 * Usage: {@code Main [MBPT|BMBPT|BMBPT_NORM] [order]}; defaults to MBPT at order 3 with two-body vertices.
 * </p>
 */
@Slf4j
public class Main {

    /**
     * Runs one generation and logs every diagram with its expression.
     *
     * @param args optional formalism and order.
     */
    public static void main(String[] args) {
        TheoryConfig config = parse(args);
        GenerationResult result = new DiagramEngine().generate(config);
        for (GeneratedDiagram diagram : result.getDiagrams()) {
            log.info("Diagram {} {} excitation {} family {} symmetry {}",
                    diagram.getIndex(),
                    diagram.getKey(),
                    diagram.excitationLevel(),
                    diagram.getClassification().getFamily().label(),
                    diagram.getSymmetryFactor());
            for (ExpressionTerm term : diagram.getExpression().timeIntegrated()) {
                log.info("  {}", term.render());
            }
        }
        log.info("{} diagrams", result.size());
    }

    static TheoryConfig parse(String[] args) {
        Formalism formalism = args.length > 0
                ? Formalism.valueOf(args[0].trim().toUpperCase(Locale.ROOT))
                : Formalism.MBPT;
        int order = args.length > 1 ? Integer.parseInt(args[1].trim()) : 3;
        return TheoryConfig.builder()
                .formalism(formalism)
                .order(order)
                .bodyRank(2)
                .build();
    }
}
