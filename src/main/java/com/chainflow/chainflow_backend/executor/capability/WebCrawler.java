package com.chainflow.chainflow_backend.executor.capability;

import org.springframework.web.client.ResourceAccessException;

/**
 * Page-fetch capability used by web-crawler nodes: loads the page, waits for selectors and extracts content.
 */
public interface WebCrawler {

    /**
     * @return the crawl outcome; failures the crawler reports come back with status "error"
     * @throws ResourceAccessException when the crawler could not be reached or timed out
     */
    CrawlResult crawl(CrawlRequest request);
}
