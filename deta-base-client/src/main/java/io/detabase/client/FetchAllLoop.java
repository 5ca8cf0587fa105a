package io.detabase.client;

import io.detabase.core.FetchResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Follows fetch cursors until the last page and collects every item in order.
 *
 * <p>This class is not intended to be used directly by clients; see {@link BaseClient#fetchAll}.
 */
final class FetchAllLoop {

    private final BaseClient client;
    private final FetchRequest request;

    FetchAllLoop(BaseClient client, FetchRequest request) {
        this.client = client;
        this.request = request;
    }

    List<Map<String, Object>> run() throws TransportException {
        List<Map<String, Object>> all = new ArrayList<>();
        FetchRequest cur = request;
        while (true) {
            FetchResponse page = client.fetch(cur);
            all.addAll(page.items());
            String next = page.last().orElse(null);
            if (next == null || next.equals(cur.last())) {
                return all;
            }
            cur = cur.after(next);
        }
    }
}
