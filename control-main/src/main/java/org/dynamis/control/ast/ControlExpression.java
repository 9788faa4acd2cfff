package org.dynamis.control.ast;

import org.dynamis.control.ast.visitor.ControlFlowVisitor;
import org.dynamis.control.printer.PrintUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The header of a control block: a keyword, optionally followed by a list of
 * sub-expression slots.
 * <pre>
 * keyword (slot0 separator slot1 separator slot2)
 * </pre>
 * Slots may individually be {@code null}. Nothing is validated here; a multi-slot
 * expression without a separator only fails once it is emitted.
 */
public final class ControlExpression implements Code {

    public static final ControlExpression DO_STATEMENT = new ControlExpression("do", List.of(), null, false);

    public static final ControlExpression TRY_STATEMENT = new ControlExpression("try", List.of(), null, false);

    public static final ControlExpression FINALLY_STATEMENT = new ControlExpression("finally", List.of(), null, false);

    private final String keyword;
    private final List<Code> slots;
    private final String separator;
    private final boolean parenthesised;

    private ControlExpression(String keyword, List<Code> slots, String separator, boolean parenthesised) {
        this.keyword = keyword;
        this.slots = slots;
        this.separator = separator;
        this.parenthesised = parenthesised;
    }

    public static ControlExpression of(String keyword, List<? extends Code> slots, String separator, boolean parenthesised) {
        Objects.requireNonNull(keyword, "keyword");
        List<Code> copy = slots == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(slots));
        return new ControlExpression(keyword, copy, separator, parenthesised);
    }

    private static ControlExpression parenthesised(String keyword, String separator, Code... slots) {
        return of(keyword, Arrays.asList(slots), separator, true);
    }

    /**
     * {@code for (initialize; condition; advance)}; every clause may be {@code null}.
     */
    public static ControlExpression forLoop(Code initialize, Code condition, Code advance) {
        return parenthesised("for", ";", initialize, condition, advance);
    }

    /**
     * {@code for (variable in object)}
     */
    public static ControlExpression forInLoop(Code variable, Code object) {
        return parenthesised("for", " in", variable, object);
    }

    /**
     * {@code await for (variable in object)}
     */
    public static ControlExpression awaitForLoop(Code variable, Code object) {
        return parenthesised("await for", " in", variable, object);
    }

    public static ControlExpression whileLoop(Code condition) {
        return parenthesised("while", null, condition);
    }

    public static ControlExpression ifStatement(Code condition) {
        return parenthesised("if", null, condition);
    }

    /**
     * {@code else} when {@code ifStatement} is {@code null}, otherwise {@code else if (...)}.
     */
    public static ControlExpression elseStatement(ControlExpression ifStatement) {
        return of("else", ifStatement == null ? List.of() : List.of(ifStatement), null, false);
    }

    /**
     * {@code catch (exception)} or {@code catch (exception, stacktrace)}.
     */
    public static ControlExpression catchStatement(String exception, String stacktrace) {
        if (stacktrace == null) {
            return parenthesised("catch", ",", JavaNode.name(exception));
        }
        return parenthesised("catch", ",", JavaNode.name(exception), JavaNode.name(stacktrace));
    }

    /**
     * {@code on type catchStatement}
     */
    public static ControlExpression onStatement(Code type, ControlExpression catchStatement) {
        return of("on", List.of(type, catchStatement), "", false);
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * @return the slots in order; entries may be {@code null}
     */
    public List<Code> getSlots() {
        return slots;
    }

    public Optional<String> getSeparator() {
        return Optional.ofNullable(separator);
    }

    public boolean isParenthesised() {
        return parenthesised;
    }

    @Override
    public <R, A> R accept(ControlFlowVisitor<R, A> visitor, A arg) {
        return visitor.visitControlExpression(this, arg);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ControlExpression)) {
            return false;
        }
        ControlExpression that = (ControlExpression) o;
        return parenthesised == that.parenthesised
                && keyword.equals(that.keyword)
                && slots.equals(that.slots)
                && Objects.equals(separator, that.separator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyword, slots, separator, parenthesised);
    }

    @Override
    public String toString() {
        return PrintUtil.print(this);
    }
}
