/*
 * Copyright 2024 Inscope Metrics
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
package com.arpnetworking.statistics.page;

/**
 * Thrown when a {@link PageSection} is accessed as a numeric kind other
 * than the one it was created with.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public final class NumberKindMismatchException extends IllegalStateException {

    /**
     * Public constructor.
     *
     * @param expected the kind of the section
     * @param actual the kind requested by the caller
     */
    public NumberKindMismatchException(final NumberKind<?> expected, final NumberKind<?> actual) {
        super(String.format("Section number kind mismatch; expected=%s, actual=%s", expected, actual));
        _expected = expected.getName();
        _actual = actual.getName();
    }

    public String getExpected() {
        return _expected;
    }

    public String getActual() {
        return _actual;
    }

    private final String _expected;
    private final String _actual;

    private static final long serialVersionUID = 1L;
}
