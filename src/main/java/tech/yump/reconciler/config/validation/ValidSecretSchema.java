package tech.yump.reconciler.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Documented
@Constraint(validatedBy = SecretSchemaValidator.class)
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidSecretSchema {
  String message() default "The declared secret schema (reconciler.secrets) is malformed.";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
