package net.tempo.executor;

import static com.google.common.base.Strings.emptyToNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ascii;
import java.io.IOException;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.time.Duration;
import java.util.Properties;
import java.util.function.Function;
import net.tempo.executor.util.Durations;
import org.immutables.value.Value;

/**
 * Executor settings. Read from {@code tempo-defaults.properties}, then {@code
 * tempo.properties}, then the environment ({@code executor.threadName} is overridden by
 * {@code EXECUTOR_THREAD_NAME}).
 */
@Value.Immutable
public interface ExecutorConfig {
  @Option("executor.threadName")
  String threadName();

  @Option("executor.callbackFailurePolicy")
  CallbackFailurePolicy callbackFailurePolicy();

  @Option("executor.shutdownTimeout")
  Duration shutdownTimeout();

  static ExecutorConfig load() throws IOException {
    var classLoader = ExecutorConfig.class.getClassLoader();
    return fromProperties(loadProperties(classLoader), System::getenv);
  }

  @VisibleForTesting
  static ExecutorConfig fromProperties(Properties properties, Function<String, String> env) {
    InvocationHandler handler = (proxy, method, args) -> {
      var option = method.getAnnotation(Option.class);
      if (option != null) {
        var valueName = option.value();
        var valueStr = readStringOption(properties, env, valueName);
        return valueStr == null ? null : parseOption(method.getReturnType(), valueStr);
      }

      throw new UnsupportedOperationException();
    };

    var classLoader = ExecutorConfig.class.getClassLoader();
    return ImmutableExecutorConfig.copyOf((ExecutorConfig) Proxy.newProxyInstance(
        classLoader, new Class<?>[]{ExecutorConfig.class}, handler));
  }

  private static Properties loadProperties(ClassLoader classLoader) throws IOException {
    var defaults = new Properties();
    try (var in = classLoader.getResourceAsStream("tempo-defaults.properties")) {
      if (in != null) {
        defaults.load(in);
      }
    }

    var properties = new Properties(defaults);
    try (var in = classLoader.getResourceAsStream("tempo.properties")) {
      if (in != null) {
        properties.load(in);
      }
    }

    return properties;
  }

  private static String readStringOption(
      Properties properties,
      Function<String, String> env,
      String name) {
    var envVarName = name
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace('.', '_')
        .toUpperCase();

    var value = emptyToNull(env.apply(envVarName));
    if (value != null) {
      return value;
    }

    return emptyToNull(properties.getProperty(name));
  }

  private static Object parseOption(Class<?> type, String value) {
    if (type.isAssignableFrom(String.class)) {
      return value;
    }

    if (type.isAssignableFrom(Duration.class)) {
      return Durations.fromString(value);
    }

    if (type.isAssignableFrom(CallbackFailurePolicy.class)) {
      return CallbackFailurePolicy.valueOf(Ascii.toUpperCase(value.strip()));
    }

    throw new IllegalArgumentException("unsupported type: " + type);
  }

  @Target(ElementType.METHOD)
  @Retention(RetentionPolicy.RUNTIME)
  @interface Option {
    String value();
  }
}
