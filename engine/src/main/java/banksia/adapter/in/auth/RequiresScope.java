package banksia.adapter.in.auth;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a resource class or method as protected by a bearer access token.
 *
 * <p>The value is a space separated scope the token must include. An empty
 * value accepts any valid token. A method annotation overrides the class one.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequiresScope {

    String value() default "";
}
