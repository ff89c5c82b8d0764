package com.trademind.memory.routing;

public record CommunicationStats(long eventsIngested, long recordsStored, long notificationsSent,
                                 long deliveryFailures, long persistenceFailures) {
}
