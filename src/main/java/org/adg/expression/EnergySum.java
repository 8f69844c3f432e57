package org.adg.expression;

import lombok.Singular;
import lombok.Value;
import lombok.Builder;

import java.util.List;

/**
 * Signed sum of single-particle energies, {@code Σ E_added - Σ E_subtracted}.
 */
@Value
@Builder
public class EnergySum {
    @Singular("add")
    List<String> added;
    @Singular("subtract")
    List<String> subtracted;

    public boolean isEmpty() {
        return added.isEmpty() && subtracted.isEmpty();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (String label : added) {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append("E_").append(label);
        }
        for (String label : subtracted) {
            sb.append(sb.length() > 0 ? " - " : "-").append("E_").append(label);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
