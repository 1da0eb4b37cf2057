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

package org.tessera.utils;

import java.time.LocalDate;

/**
 * 日期时间的内部表示转换工具。
 *
 * <p>DATE 列内部存储为自 1970-01-01 起的天数(int),TIMESTAMP 列存储为 epoch 毫秒(long)。
 */
public class DateTimeUtils {

    /** 将年月日转换为内部的天数表示。 */
    public static int toInternal(int year, int month, int day) {
        return toInternal(LocalDate.of(year, month, day));
    }

    public static int toInternal(LocalDate date) {
        return Math.toIntExact(date.toEpochDay());
    }

    public static LocalDate toLocalDate(int epochDay) {
        return LocalDate.ofEpochDay(epochDay);
    }

    private DateTimeUtils() {}
}
