package com.musicgraph.harvester.download;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * Opens media payloads by URL.
 */
public interface MediaTransport {

    /**
     * @param url resolved media URL
     * @return open response; the caller closes it
     * @throws IOException on transport failure
     * @throws com.musicgraph.harvester.error.DownloadException if the server refuses the request
     */
    MediaResponse open(String url) throws IOException;

    /**
     * Open media payload.
     *
     * @param contentLength declared size in bytes, -1 when unknown
     * @param body payload stream
     */
    record MediaResponse(long contentLength, InputStream body) implements Closeable {
        @Override
        public void close() throws IOException {
            body.close();
        }
    }
}
