package com.kinoscope.metadata.resolve.api;

import com.kinoscope.metadata.resolve.model.MergedMovie;
import com.kinoscope.metadata.resolve.model.SeedRecord;

public record ResolveApiRequest(
    SeedRecord seed,
    String sourceHtml,
    MergedMovie existing
) {
}
