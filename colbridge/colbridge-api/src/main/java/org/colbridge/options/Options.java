/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.colbridge.options;

import org.colbridge.annotation.Public;

import javax.annotation.concurrent.ThreadSafe;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 以字符串键值对保存的配置,读取时按 {@link ConfigOption} 的类型转换。
 *
 * <p>所有方法都是同步的,可以在多个线程间共享。
 */
@Public
@ThreadSafe
public class Options implements Serializable {

    private static final long serialVersionUID = 1L;

    private final HashMap<String, String> data;

    public Options() {
        this.data = new HashMap<>();
    }

    public Options(Map<String, String> map) {
        this();
        map.forEach(this::setString);
    }

    public static Options fromMap(Map<String, String> map) {
        return new Options(map);
    }

    public synchronized void setString(String key, String value) {
        data.put(key, value);
    }

    public synchronized <T> Options set(ConfigOption<T> option, T value) {
        if (value == null) {
            throw new NullPointerException("Value must not be null.");
        }
        data.put(option.key(), OptionsUtils.convertToString(value));
        return this;
    }

    /** 读取配置值,缺失时返回默认值。 */
    public synchronized <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    public synchronized String get(String key) {
        return data.get(key);
    }

    public synchronized <T> Optional<T> getOptional(ConfigOption<T> option) {
        Optional<String> rawValue = getRawValue(option);
        Class<?> clazz = option.getClazz();

        try {
            return rawValue.map(v -> OptionsUtils.convertValue(v, clazz));
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    String.format(
                            "Could not parse value '%s' for key '%s'.",
                            rawValue.orElse(""), option.key()),
                    e);
        }
    }

    public synchronized boolean contains(ConfigOption<?> option) {
        return getRawValue(option).isPresent();
    }

    public synchronized Map<String, String> toMap() {
        return new HashMap<>(data);
    }

    public synchronized String remove(String key) {
        return data.remove(key);
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Options options = (Options) o;
        return Objects.equals(data, options.data);
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(data);
    }

    @Override
    public synchronized String toString() {
        return data.toString();
    }

    private Optional<String> getRawValue(ConfigOption<?> option) {
        String value = data.get(option.key());
        if (value != null) {
            return Optional.of(value);
        }
        for (String fallbackKey : option.fallbackKeys()) {
            value = data.get(fallbackKey);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
