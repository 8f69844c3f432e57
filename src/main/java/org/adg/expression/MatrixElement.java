package org.adg.expression;

import lombok.Value;

import java.util.List;

/**
 * Vertex matrix element {@code <bra|operator|ket>}; bra holds the labels of outgoing lines,
 * ket those of incoming lines.
 */
@Value
public class MatrixElement {
    String operator;
    List<String> bra;
    List<String> ket;

    public MatrixElement(String operator, List<String> bra, List<String> ket) {
        this.operator = operator;
        this.bra = List.copyOf(bra);
        this.ket = List.copyOf(ket);
    }

    public String render() {
        return "<" + String.join(" ", bra) + "|" + operator + "|" + String.join(" ", ket) + ">";
    }

    @Override
    public String toString() {
        return render();
    }
}
