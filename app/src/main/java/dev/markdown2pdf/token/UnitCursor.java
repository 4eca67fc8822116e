package dev.markdown2pdf.token;

import dev.markdown2pdf.lexer.LexicalUnit;
import java.util.List;
import java.util.Objects;

final class UnitCursor {

    private final List<LexicalUnit> units;
    private int index;

    UnitCursor(List<LexicalUnit> units) {
        this.units = Objects.requireNonNull(units, "units");
    }

    boolean hasNext() {
        return index < units.size();
    }

    LexicalUnit peek() {
        return hasNext() ? units.get(index) : null;
    }

    LexicalUnit next() {
        if (!hasNext()) {
            throw new StructuralException("Unit stream exhausted after " + units.size() + " units");
        }
        return units.get(index++);
    }
}
