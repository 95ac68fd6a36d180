package com.insightops.dashboard.devops;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * WIQL statements issued by the work item tasks, and parsing of their responses.
 */
final class WiqlQueries {

    static final String QUERY_WORK_ITEMS = "query_work_items";

    private static final String CLOSED_STATES = "('Closed', 'Done', 'Removed', 'Resolved')";

    private WiqlQueries() {
    }

    /** Work items of the project changed since the start of yesterday. */
    static Map<String, String> recentlyChanged() {
        return Map.of("query", "SELECT [System.Id] FROM WorkItems"
                + " WHERE [System.TeamProject] = @project"
                + " AND [System.ChangedDate] >= @Today - 1"
                + " ORDER BY [System.ChangedDate] DESC");
    }

    /**
     * Open work items whose due date has passed.
     *
     * @param maxDaysOverdue ignore items due more than this many days ago; 0 or less disables the bound
     */
    static Map<String, String> overdue(int maxDaysOverdue) {
        StringBuilder wiql = new StringBuilder("SELECT [System.Id] FROM WorkItems")
                .append(" WHERE [System.TeamProject] = @project")
                .append(" AND [Microsoft.VSTS.Scheduling.DueDate] < @Today")
                .append(" AND [System.State] NOT IN ").append(CLOSED_STATES);
        if (maxDaysOverdue > 0) {
            wiql.append(" AND [Microsoft.VSTS.Scheduling.DueDate] >= @Today - ").append(maxDaysOverdue);
        }
        wiql.append(" ORDER BY [Microsoft.VSTS.Scheduling.DueDate] ASC");
        return Map.of("query", wiql.toString());
    }

    /** Extracts {@code workItems[].id} from a WIQL response. */
    static List<Integer> workItemIds(JsonNode response) {
        List<Integer> ids = new ArrayList<>();
        if (response == null) {
            return ids;
        }
        JsonNode workItems = response.path("workItems");
        if (workItems.isArray()) {
            for (JsonNode item : workItems) {
                if (item.hasNonNull("id")) {
                    ids.add(item.get("id").asInt());
                }
            }
        }
        return ids;
    }
}
