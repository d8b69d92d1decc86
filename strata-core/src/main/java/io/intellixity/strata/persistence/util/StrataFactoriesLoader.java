package io.intellixity.strata.persistence.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for strata SPIs.\n
 *
 * Reads every {@code META-INF/strata.factories} resource on the classpath. Each resource is a Java
 * Properties file keyed by SPI interface name:\n
 *\n
 * <pre>\n
 * io.intellixity.strata.persistence.value.CodecProvider=com.acme.TagCodecs\n
 * io.intellixity.strata.persistence.spi.bind.BinderProvider=com.acme.MyBinders,com.acme.OtherBinders\n
 * </pre>\n
 */
public final class StrataFactoriesLoader {
  public static final String RESOURCE = "META-INF/strata.factories";

  private StrataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = StrataFactoriesLoader.class.getClassLoader();

    LinkedHashSet<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(newInstance(implName, spiType, cl));
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Unknown class " + implName + " listed for SPI " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
