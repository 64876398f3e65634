package io.aitk.jetty.testserver;


/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/**
 * A request seen by a {@link HubServerFixture}.
 *
 * @param method the HTTP method
 * @param path the decoded request path
 * @param query the raw query string, or null
 * @param authorization the Authorization header, or null
 * @param userAgent the User-Agent header, or null
 */
public record RecordedRequest(String method, String path, String query, String authorization, String userAgent) {

    public boolean authenticated() {
        return authorization != null;
    }

    public boolean hasDownloadFlag() {
        return query != null && query.contains("download=true");
    }
}
