package com.contenttracker.integration;

import com.contenttracker.application.port.in.ContentInteractionUseCase;
import com.contenttracker.application.port.in.EngagementTrackingUseCase;
import com.contenttracker.application.port.in.FollowActorUseCase;
import com.contenttracker.application.port.in.MediaDownloadUseCase;
import com.contenttracker.application.port.in.SaveContentUseCase;
import com.contenttracker.application.port.in.ThreadUseCase;
import com.contenttracker.application.port.out.EventOutbox;
import com.contenttracker.infrastructure.config.AppProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Smoke tests to verify the application context loads correctly
 * and every use case is wired.
 */
@SpringBootTest
class ContentTrackerApplicationContextTest {

    @Autowired
    private SaveContentUseCase saveContentUseCase;

    @Autowired
    private ContentInteractionUseCase contentInteractionUseCase;

    @Autowired
    private FollowActorUseCase followActorUseCase;

    @Autowired
    private EngagementTrackingUseCase engagementTrackingUseCase;

    @Autowired
    private MediaDownloadUseCase mediaDownloadUseCase;

    @Autowired
    private ThreadUseCase threadUseCase;

    @Autowired
    private EventOutbox eventOutbox;

    @Autowired
    private AppProperties appProperties;

    @Test
    void contextLoads() {
        assertNotNull(saveContentUseCase);
        assertNotNull(contentInteractionUseCase);
        assertNotNull(followActorUseCase);
        assertNotNull(engagementTrackingUseCase);
        assertNotNull(mediaDownloadUseCase);
        assertNotNull(threadUseCase);
        assertNotNull(eventOutbox);
    }

    @Test
    void testPropertiesShouldBeBound() {
        assertEquals("content-tracker-test", appProperties.getEvents().getSource());
        assertEquals(100, appProperties.getEvents().getOutboxCapacity());
        assertEquals(50, appProperties.getStore().getMaxEntries());
    }
}
