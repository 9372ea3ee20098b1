package io.intellixity.tessera.persistence.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Finds extension implementations listed in {@code META-INF/tessera.factories}.\n
 *
 * Every such resource visible to the class loader is a Properties file keyed by extension type name:\n
 *\n
 * <pre>\n
 * io.intellixity.tessera.persistence.dialect.Dialect=com.acme.MyDialect, com.acme.OtherDialect\n
 * </pre>\n
 *
 * A class listed more than once is instantiated once, at the position of its first listing.\n
 */
public final class TesseraFactoriesLoader {
  public static final String RESOURCE = "META-INF/tessera.factories";

  private final ClassLoader classLoader;

  private TesseraFactoriesLoader(ClassLoader classLoader) {
    this.classLoader = classLoader;
  }

  /** Loader over the given class loader, or the one that loaded tessera when {@code null}. */
  public static TesseraFactoriesLoader forClassLoader(ClassLoader classLoader) {
    return new TesseraFactoriesLoader(classLoader != null ? classLoader : TesseraFactoriesLoader.class.getClassLoader());
  }

  /** Instances of every implementation registered on the context class loader. */
  public static <T> List<T> load(Class<T> extensionType) {
    return forClassLoader(Thread.currentThread().getContextClassLoader()).instantiate(extensionType);
  }

  /** Implementation class names registered for {@code extensionType}, each with the file that first listed it. */
  public Map<String, URL> registrations(Class<?> extensionType) {
    Objects.requireNonNull(extensionType, "extensionType");
    Map<String, URL> found = new LinkedHashMap<>();
    for (URL file : factoryFiles()) {
      for (String className : classNames(read(file).getProperty(extensionType.getName()))) {
        found.putIfAbsent(className, file);
      }
    }
    return found;
  }

  public <T> List<T> instantiate(Class<T> extensionType) {
    List<T> out = new ArrayList<>();
    registrations(extensionType).forEach((className, file) -> out.add(create(extensionType, className, file)));
    return out;
  }

  private List<URL> factoryFiles() {
    try {
      return Collections.list(classLoader.getResources(RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + RESOURCE + " resources", e);
    }
  }

  private static Properties read(URL file) {
    Properties p = new Properties();
    try (InputStream in = file.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + file, e);
    }
    return p;
  }

  static List<String> classNames(String value) {
    if (value == null) return List.of();
    List<String> names = new ArrayList<>();
    for (String part : value.split(",")) {
      if (!part.isBlank()) names.add(part.strip());
    }
    return names;
  }

  private <T> T create(Class<T> extensionType, String className, URL file) {
    Class<?> impl;
    try {
      impl = Class.forName(className, true, classLoader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException(file + " lists unknown class " + className + " for " + extensionType.getName(), e);
    }
    if (!extensionType.isAssignableFrom(impl)) {
      throw new IllegalStateException(file + " lists " + className + ", which is not a " + extensionType.getName());
    }
    try {
      return extensionType.cast(impl.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot instantiate " + className + " listed in " + file, e);
    }
  }
}
