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
package io.isima.vista.errors.exception;

import io.isima.vista.errors.VistaError;
import io.netty.handler.codec.http.HttpResponseStatus;
import java.util.Objects;

/**
 * An exception thrown when an application error occurred.
 *
 * <p>The service boundary translates the exception into an error response using the status of
 * the carried {@link VistaError}.
 */
public class VistaException extends Exception implements VistaError {

  private static final long serialVersionUID = 4720913458701928375L;

  protected final VistaError info;

  protected String mymessage;

  public VistaException(VistaError info, String additionalMessage) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public VistaError getInfo() {
    return info;
  }

  @Override
  public String getErrorCode() {
    return info.getErrorCode();
  }

  @Override
  public HttpResponseStatus getStatus() {
    return info.getStatus();
  }

  @Override
  public String getMessage() {
    return mymessage;
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }
}
