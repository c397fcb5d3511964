/*
 * Copyright (c) 2025 Cumulocity GmbH.
 *
 * SPDX-License-Identifier: Apache-2.0
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *  @authors Christof Strack, Stefan Witschel
 *
 */

package pulsar.mapper.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one call to the platform. {@code httpStatus} is 0 when no
 * response was received.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SubmissionResult {

    SubmissionStatus status;
    int httpStatus;
    String message;

    public static SubmissionResult success(int httpStatus) {
        return new SubmissionResult(SubmissionStatus.SUCCESS, httpStatus, "");
    }

    public static SubmissionResult validationFailure(String message) {
        return new SubmissionResult(SubmissionStatus.VALIDATION_FAILURE, 0, message);
    }

    public static SubmissionResult transientFailure(int httpStatus, String message) {
        return new SubmissionResult(SubmissionStatus.TRANSIENT_FAILURE, httpStatus, message);
    }

    public static SubmissionResult permanentRejection(int httpStatus, String message) {
        return new SubmissionResult(SubmissionStatus.PERMANENT_REJECTION, httpStatus, message);
    }

    /**
     * Classifies a response status: 2xx succeeds, 4xx other than 429 is a
     * permanent rejection, everything else (429, 5xx, no response, unexpected
     * codes) is transient.
     */
    public static SubmissionResult fromHttpStatus(int httpStatus, String message) {
        if (httpStatus >= 200 && httpStatus < 300) {
            return success(httpStatus);
        }
        if (isPermanent(httpStatus)) {
            return permanentRejection(httpStatus, message);
        }
        return transientFailure(httpStatus, message);
    }

    public static boolean isPermanent(int httpStatus) {
        return httpStatus >= 400 && httpStatus < 500 && httpStatus != 429;
    }

    public boolean isSuccess() {
        return status == SubmissionStatus.SUCCESS;
    }
}
