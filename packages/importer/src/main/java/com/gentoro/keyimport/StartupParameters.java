package com.gentoro.keyimport;

import com.gentoro.keyimport.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line arguments in {@code --name=value} form. A bare {@code --name} is a flag with value
 * {@code "true"}.
 *
 * <p>Recognised names: {@code files} (comma separated), {@code dir}, {@code config}, {@code
 * report}, {@code mode} ({@code interactive} or {@code once}) and {@code manual-passwords}.
 */
public class StartupParameters {
  public static final String FILES = "files";
  public static final String DIRECTORY = "dir";
  public static final String CONFIG = "config";
  public static final String REPORT = "report";
  public static final String MODE = "mode";
  public static final String MANUAL_PASSWORDS = "manual-passwords";

  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (StringUtils.isBlank(arg)) {
        continue;
      }
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigurationException("Unrecognised argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public boolean has(String name) {
    return parameters.containsKey(name);
  }

  @SuppressWarnings("unchecked")
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return (T) raw;
    }
    if (type == Boolean.class) {
      return (T) Boolean.valueOf(raw);
    }
    if (type == Path.class) {
      return (T) Path.of(raw);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public String configFile() {
    return StringUtils.trimToNull(getParameter(CONFIG, String.class));
  }

  public List<Path> files() {
    String raw = getParameter(FILES, String.class);
    if (StringUtils.isBlank(raw)) {
      return List.of();
    }
    return Arrays.stream(StringUtils.split(raw, ','))
        .map(String::trim)
        .filter(StringUtils::isNotEmpty)
        .map(Path::of)
        .toList();
  }

  public Path directory() {
    String raw = StringUtils.trimToNull(getParameter(DIRECTORY, String.class));
    return raw == null ? null : Path.of(raw);
  }

  public Path reportFile() {
    String raw = StringUtils.trimToNull(getParameter(REPORT, String.class));
    return raw == null ? null : Path.of(raw);
  }

  public String mode() {
    return StringUtils.defaultIfBlank(getParameter(MODE, String.class), "interactive");
  }

  public boolean manualPasswords() {
    return Boolean.TRUE.equals(getParameter(MANUAL_PASSWORDS, Boolean.class));
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
