/**
 * cryostar: STAR metadata interchange for cryo-EM image processing.
 *
 * Copyright (C) 2015 The cryostar authors
 *
 * This file is part of cryostar.
 *
 * cryostar is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.cryostar.config;

import java.lang.reflect.Field;

import javax.inject.Inject;

import org.cryostar.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.FatalBeanException;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.util.ReflectionUtils;

/**
 * Injects configuration values into all fields annotated with {@link Config}, including those declared in super
 * classes of a bean.
 * 
 * <p>
 * Supported field types are String, the boxed and primitive long, int, double and boolean types and enums, whose
 * values are resolved by constant name.
 */
@AutoInstatiate
public class ConfigurationPostProcessor implements BeanPostProcessor {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationPostProcessor.class);

  @Inject
  private ConfigurationManager configManager;

  @Override
  public Object postProcessBeforeInitialization(Object bean, String beanName) throws BeansException {
    ReflectionUtils.doWithFields(bean.getClass(), field -> inject(bean, field),
        field -> field.isAnnotationPresent(Config.class));
    return bean;
  }

  private void inject(Object bean, Field field) {
    String key = field.getAnnotation(Config.class).value();
    String target = bean.getClass().getName() + "." + field.getName();

    String raw = configManager.getValue(key);
    if (raw == null)
      throw new FatalBeanException("No configuration value available for '" + key + "', required by " + target);

    Object value = parse(raw.trim(), field.getType(), target);
    logger.debug("Setting {} = '{}' from configuration key '{}'", target, value, key);
    ReflectionUtils.makeAccessible(field);
    ReflectionUtils.setField(field, bean, value);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  private Object parse(String raw, Class<?> type, String target) {
    try {
      if (type == String.class)
        return raw;
      if (type == Long.class || type == long.class)
        return Long.parseLong(raw);
      if (type == Integer.class || type == int.class)
        return Integer.parseInt(raw);
      if (type == Double.class || type == double.class)
        return Double.parseDouble(raw);
      if (type == Boolean.class || type == boolean.class)
        return Boolean.parseBoolean(raw);
      if (type.isEnum())
        return Enum.valueOf((Class<? extends Enum>) type, raw);
    } catch (IllegalArgumentException e) {
      // NumberFormatException included.
      throw new FatalBeanException("Cannot use '" + raw + "' as " + type.getSimpleName() + " for " + target, e);
    }
    throw new FatalBeanException("Configuration values of type " + type.getName() + " are not supported (" + target
        + ")");
  }
}
