package com.tarantula.crawl.sink;

import com.tarantula.crawl.model.DeliveryStatus;
import com.tarantula.crawl.model.PageResult;
import com.tarantula.crawl.model.RunConfig;
import com.tarantula.crawl.model.RunFinishedEvent;

/**
 * Destination for crawl output. Implementations must not block the calling worker.
 */
public interface ResultSink {
    DeliveryStatus deliver(RunConfig config, PageResult result);

    DeliveryStatus runFinished(RunConfig config, RunFinishedEvent event);
}
