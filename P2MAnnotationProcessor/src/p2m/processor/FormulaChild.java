package p2m.processor;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** Marks an accessor of a {@link FormulaNode} whose result is visited as a child. */
@Retention(RetentionPolicy.SOURCE)
@Target(ElementType.METHOD)
public @interface FormulaChild {}
