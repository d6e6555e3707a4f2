package tech.yump.reconciler.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.util.StringUtils;
import tech.yump.reconciler.config.ReconcilerProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Cross-field checks on the secret schema that single-field constraints cannot express.
 */
public class SecretSchemaValidator implements ConstraintValidator<ValidSecretSchema, ReconcilerProperties> {

  // Same character set the API server accepts for secret data keys
  private static final Pattern DATA_KEY = Pattern.compile("[-._a-zA-Z0-9]+");
  // Object names: lowercase RFC 1123 subdomain
  private static final Pattern DNS_SUBDOMAIN =
      Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");
  private static final int MAX_NAME_LENGTH = 253;

  @Override
  public boolean isValid(ReconcilerProperties value, ConstraintValidatorContext context) {
    if (value == null || value.secrets() == null) {
      return true; // @NotEmpty on the field reports the missing list
    }

    List<String> problems = new ArrayList<>();
    Set<String> secretNames = new HashSet<>();

    for (ReconcilerProperties.SecretDefinition secret : value.secrets()) {
      if (secret == null || !StringUtils.hasText(secret.name())) {
        continue;
      }
      if (!secretNames.add(secret.name())) {
        problems.add("Duplicate secret name '" + secret.name() + "'.");
      }
      if (secret.name().length() > MAX_NAME_LENGTH || !DNS_SUBDOMAIN.matcher(secret.name()).matches()) {
        problems.add("Invalid secret name '" + secret.name() + "': must be a lowercase DNS-1123 subdomain of at most "
            + MAX_NAME_LENGTH + " characters.");
      }
      if (secret.keys() == null) {
        continue;
      }
      Set<String> keyNames = new HashSet<>();
      for (ReconcilerProperties.KeyDefinition key : secret.keys()) {
        if (key == null || !StringUtils.hasText(key.name())) {
          continue;
        }
        String where = "secret '" + secret.name() + "', key '" + key.name() + "'";
        if (!keyNames.add(key.name())) {
          problems.add("Duplicate key in " + where + ".");
        }
        if (!DATA_KEY.matcher(key.name()).matches()) {
          problems.add("Invalid data key name in " + where + ".");
        }
        if (StringUtils.hasText(key.pattern())) {
          try {
            Pattern.compile(key.pattern());
          } catch (PatternSyntaxException e) {
            problems.add("Pattern does not compile in " + where + ".");
          }
        }
        if (value.backend() == ReconcilerProperties.Backend.EXTERNAL && !StringUtils.hasText(key.remoteKey())) {
          problems.add("External backend requires remote-key in " + where + ".");
        }
      }
    }

    if (value.backend() == ReconcilerProperties.Backend.EXTERNAL
        && (value.external() == null || !StringUtils.hasText(value.external().storeName()))) {
      problems.add("External backend requires reconciler.external.store-name.");
    }

    if (problems.isEmpty()) {
      return true;
    }
    context.disableDefaultConstraintViolation();
    problems.forEach(p -> context.buildConstraintViolationWithTemplate(p).addConstraintViolation());
    return false;
  }
}
