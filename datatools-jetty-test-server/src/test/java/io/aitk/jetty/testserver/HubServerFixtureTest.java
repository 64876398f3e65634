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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPInputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the HubServerFixture class.
 * This test verifies the hub URL layout and the per-file response behaviors.
 */
@ExtendWith(HubServerExtension.class)
public class HubServerFixtureTest {

    private static final byte[] CONTENT = "PAR1 hosted content PAR1".getBytes(StandardCharsets.US_ASCII);

    @Test
    public void testServesDatasetAndModelRoutes(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/cats", "main", "data/train.parquet", CONTENT);
        hub.hostModel("acme/vit", "v1", "sample.parquet", CONTENT);

        Response dataset = get(hub, "/datasets/acme/cats/resolve/main/data/train.parquet", null);
        assertEquals(200, dataset.status);
        assertArrayEquals(CONTENT, dataset.body);

        Response model = get(hub, "/acme/vit/resolve/v1/sample.parquet", null);
        assertEquals(200, model.status);

        List<RecordedRequest> requests = hub.getRequests();
        assertEquals(2, requests.size());
        assertEquals("/datasets/acme/cats/resolve/main/data/train.parquet", requests.get(0).path());
        assertFalse(requests.get(0).authenticated());
    }

    @Test
    public void testUnknownPathIsNotFoundWithErrorHeader(HubServerFixture hub) throws IOException {
        Response response = get(hub, "/datasets/acme/missing/resolve/main/x.parquet", null);
        assertEquals(404, response.status);
        assertEquals("Entry not found", response.errorMessage);
    }

    @Test
    public void testDecodesEscapedPaths(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/cats", "main", "my data/train.parquet", CONTENT);

        Response response = get(hub, "/datasets/acme/cats/resolve/main/my%20data/train.parquet", null);
        assertEquals(200, response.status);
        assertEquals("/datasets/acme/cats/resolve/main/my data/train.parquet", hub.getRequests().get(0).path());
    }

    @Test
    public void testRequiredTokenPolicy(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/private", "main", "a.parquet", CONTENT).requireToken("hf_good");
        String path = "/datasets/acme/private/resolve/main/a.parquet";

        assertEquals(401, get(hub, path, null).status);
        assertEquals(401, get(hub, path, "Bearer hf_bad").status);
        assertEquals(200, get(hub, path, "Bearer hf_good").status);
        assertEquals("Bearer hf_good", hub.getRequests().get(2).authorization());
    }

    @Test
    public void testRejectedTokenPolicy(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/public", "main", "a.parquet", CONTENT).rejectTokens();
        String path = "/datasets/acme/public/resolve/main/a.parquet";

        Response rejected = get(hub, path, "Bearer hf_revoked");
        assertEquals(401, rejected.status);
        assertNotNull(rejected.errorMessage);
        assertEquals(200, get(hub, path, null).status);
    }

    @Test
    public void testGzipEncodedBody(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/cats", "main", "a.parquet", CONTENT).gzipEncoded();

        Response response = get(hub, "/datasets/acme/cats/resolve/main/a.parquet", null);
        assertEquals("gzip", response.contentEncoding);
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(response.body))) {
            assertArrayEquals(CONTENT, in.readAllBytes());
        }
    }

    @Test
    public void testRedirectThroughCdn(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/cats", "main", "a.parquet", CONTENT).redirectThroughCdn();

        Response response = get(hub, "/datasets/acme/cats/resolve/main/a.parquet", null);
        assertEquals(200, response.status);
        assertArrayEquals(CONTENT, response.body);
        assertTrue(response.finalUrl.contains("/cdn/"), response.finalUrl);
    }

    @Test
    public void testFailureAndDownloadFlag(HubServerFixture hub) throws IOException {
        hub.hostDataset("acme/cats", "main", "broken.parquet", CONTENT).failWith(503, "Service busy");
        hub.hostDataset("acme/cats", "main", "flagged.parquet", CONTENT).requireDownloadFlag();

        Response broken = get(hub, "/datasets/acme/cats/resolve/main/broken.parquet", null);
        assertEquals(503, broken.status);
        assertEquals("Service busy", broken.errorMessage);

        assertEquals(404, get(hub, "/datasets/acme/cats/resolve/main/flagged.parquet", null).status);
        assertEquals(200, get(hub, "/datasets/acme/cats/resolve/main/flagged.parquet?download=true", null).status);
        assertTrue(hub.getRequests().get(2).hasDownloadFlag());
    }

    private Response get(HubServerFixture hub, String path, String authorization) throws IOException {
        URL url = new URL(hub.getHost() + path);
        HttpURLConnection connection = (HttpURLConnection) url.openConnection();
        if (authorization != null) {
            connection.setRequestProperty("Authorization", authorization);
        }
        try {
            int status = connection.getResponseCode();
            InputStream stream = status < 400 ? connection.getInputStream() : connection.getErrorStream();
            byte[] body = stream == null ? new byte[0] : stream.readAllBytes();
            return new Response(status, body, connection.getHeaderField("X-Error-Message"),
                connection.getHeaderField("Content-Encoding"), connection.getURL().toString());
        } finally {
            connection.disconnect();
        }
    }

    private record Response(int status, byte[] body, String errorMessage, String contentEncoding, String finalUrl) {
    }
}
