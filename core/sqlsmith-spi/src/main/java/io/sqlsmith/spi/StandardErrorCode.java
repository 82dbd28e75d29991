/*
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
package io.sqlsmith.spi;

import static io.sqlsmith.spi.ErrorType.INTERNAL_ERROR;

public enum StandardErrorCode
        implements ErrorCodeSupplier
{
    GENERIC_INTERNAL_ERROR(0x0001_0000, INTERNAL_ERROR),
    TYPE_NOT_FOUND(0x0001_0001, INTERNAL_ERROR),
    /**/;

    private final ErrorCode errorCode;

    StandardErrorCode(int code, ErrorType type)
    {
        errorCode = new ErrorCode(code, name(), type);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
