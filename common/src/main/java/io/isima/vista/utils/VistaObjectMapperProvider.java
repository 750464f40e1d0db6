/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.vista.utils;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAccessor;

/** Class that provides ObjectMapper instances that is specialized for Vista service. */
public class VistaObjectMapperProvider {
  private static final ObjectMapper vistaMapper;

  static {
    vistaMapper =
        new ObjectMapper()
            .registerModule(
                new SimpleModule()
                    .addSerializer(LocalDate.class, new IsoTemporalSerializer<>(LocalDate.class))
                    .addSerializer(LocalTime.class, new IsoTemporalSerializer<>(LocalTime.class))
                    .addSerializer(
                        LocalDateTime.class, new IsoTemporalSerializer<>(LocalDateTime.class)))
            .configure(JsonParser.Feature.ALLOW_UNQUOTED_CONTROL_CHARS, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public static ObjectMapper get() {
    return vistaMapper;
  }

  /**
   * This class serializes temporal field values.
   *
   * <p>Values are written as ISO-8601 strings such as 2007-12-03 or 2007-12-03T10:15:30, which is
   * how date, time and datetime fields appear in exported and previewed rows.
   */
  private static class IsoTemporalSerializer<T extends TemporalAccessor> extends StdSerializer<T> {
    private static final long serialVersionUID = -2981547720583640193L;

    public IsoTemporalSerializer(Class<T> t) {
      super(t);
    }

    @Override
    public void serialize(T value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeString(value.toString());
    }
  }
}
