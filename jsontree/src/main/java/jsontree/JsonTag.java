package jsontree;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Field tag: {@code name,opt1,opt2,...}.
 *
 * <ul>
 *   <li>an empty name keeps the declared field name, {@code "-"} ignores the field</li>
 *   <li>{@code string} decodes numbers and booleans from their quoted form</li>
 *   <li>a registered encoding name, e.g. {@code hex}, selects the byte encoding</li>
 *   <li>either option wrapped in brackets, e.g. {@code [string]}, applies to container elements</li>
 * </ul>
 *
 * <pre>{@code
 * public class Payload {
 *     @JsonTag("id,string")
 *     public long id;
 *
 *     @JsonTag(",[hex]")
 *     public List<byte[]> keys;
 * }
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT})
public @interface JsonTag {
    String value();
}
