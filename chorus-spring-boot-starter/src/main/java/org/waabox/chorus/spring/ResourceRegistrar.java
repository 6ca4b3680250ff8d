package org.waabox.chorus.spring;

import org.waabox.chorus.Chorus;

/**
 * A callback interface for adding resources, or any other setting, to the
 * {@link Chorus} builder during Spring Boot auto-configuration.
 *
 * <p>Implement this interface as a Spring bean. All discovered
 * {@code ResourceRegistrar} beans are invoked after the {@code chorus.*}
 * properties were applied and before the instance is built, so a
 * registrar wins over the properties.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * ResourceRegistrar membersRegistrar() {
 *     return builder -> builder.resources("members", "member_roles");
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ResourceRegistrar {

  /**
   * Registers resources with the given builder.
   *
   * @param builder the builder of the Chorus instance, never null
   */
  void register(Chorus.Builder builder);
}
