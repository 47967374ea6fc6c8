package p2m.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a formula tree node. The node must implement the generated
 * {@code <Outer>_<Node>_FormulaNode} interface, which supplies {@code accept} and
 * {@code visitChildren}.
 */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.TYPE)
public @interface FormulaNode {}
