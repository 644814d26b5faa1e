package jsontree;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a public field whose own public fields are decoded as if declared by the enclosing class.
 *
 * <p> A missing embedded instance is created on demand. A field with a tag name is not embedded.
 *
 * @author Freeman
 * @since 0.1.0
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Embedded {}
