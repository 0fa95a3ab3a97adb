package uk.gegc.scriptflow.features.flowsync.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.scriptflow.BaseUnitTest;
import uk.gegc.scriptflow.features.flow.domain.model.Flow;
import uk.gegc.scriptflow.features.flow.domain.repository.FlowConnectionRepository;
import uk.gegc.scriptflow.features.flow.domain.repository.FlowNodeRepository;
import uk.gegc.scriptflow.features.flow.domain.repository.FlowRepository;
import uk.gegc.scriptflow.features.flowsync.api.dto.FlowLinkDto;
import uk.gegc.scriptflow.features.flowsync.api.dto.SyncReportDto;
import uk.gegc.scriptflow.features.flowsync.application.FlowLayout;
import uk.gegc.scriptflow.features.flowsync.application.FlowTraversal;
import uk.gegc.scriptflow.features.flowsync.application.PageTreeBuilder;
import uk.gegc.scriptflow.features.flowsync.config.FlowSyncProperties;
import uk.gegc.scriptflow.features.flowsync.infra.grouping.ElementGrouper;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ForwardNodeMapper;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ResponseChoiceCodec;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ReverseNodeMapper;
import uk.gegc.scriptflow.features.screenplay.domain.model.Screenplay;
import uk.gegc.scriptflow.features.screenplay.domain.repository.ScreenplayElementRepository;
import uk.gegc.scriptflow.features.screenplay.domain.repository.ScreenplayRepository;
import uk.gegc.scriptflow.shared.exception.NotLinkedException;
import uk.gegc.scriptflow.shared.exception.ResourceNotFoundException;
import uk.gegc.scriptflow.shared.exception.ValidationException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static uk.gegc.scriptflow.testsupport.ScreenplayFixtures.MAPPER;

@DisplayName("FlowSyncServiceImpl Tests")
class FlowSyncServiceImplTest extends BaseUnitTest {

    @Mock private ScreenplayRepository screenplayRepository;
    @Mock private ScreenplayElementRepository elementRepository;
    @Mock private FlowRepository flowRepository;
    @Mock private FlowNodeRepository nodeRepository;
    @Mock private FlowConnectionRepository connectionRepository;

    private FlowSyncProperties properties;
    private FlowSyncServiceImpl service;

    @BeforeEach
    void setUp() {
        properties = new FlowSyncProperties();
        ResponseChoiceCodec codec = new ResponseChoiceCodec(MAPPER);
        service = new FlowSyncServiceImpl(
                screenplayRepository,
                elementRepository,
                flowRepository,
                nodeRepository,
                connectionRepository,
                new PageTreeBuilder(new ElementGrouper(), new ForwardNodeMapper(codec)),
                new FlowLayout(properties),
                new FlowTraversal(),
                new ReverseNodeMapper(codec),
                properties);
    }

    private Screenplay screenplay(UUID id, UUID parentId, UUID linkedFlowId) {
        Screenplay screenplay = new Screenplay();
        screenplay.setId(id);
        screenplay.setName("Page " + id);
        screenplay.setParentId(parentId);
        screenplay.setLinkedFlowId(linkedFlowId);
        return screenplay;
    }

    @Test
    @DisplayName("Should reject pull when the page has no linked flow")
    void shouldRejectPullWhenNotLinked() {
        UUID rootId = UUID.randomUUID();
        when(screenplayRepository.findById(rootId)).thenReturn(Optional.of(screenplay(rootId, null, null)));

        assertThrows(NotLinkedException.class, () -> service.syncFromFlow(rootId));
        verifyNoInteractions(nodeRepository, connectionRepository);
    }

    @Test
    @DisplayName("Should report a linked flow that no longer exists")
    void shouldReportMissingLinkedFlow() {
        UUID rootId = UUID.randomUUID();
        UUID flowId = UUID.randomUUID();
        when(screenplayRepository.findById(rootId)).thenReturn(Optional.of(screenplay(rootId, null, flowId)));
        when(flowRepository.findById(flowId)).thenReturn(Optional.empty());

        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class, () -> service.syncFromFlow(rootId));

        assertTrue(ex.getMessage().contains(flowId.toString()));
    }

    @Test
    @DisplayName("Should require a flow id when linking")
    void shouldRequireFlowIdWhenLinking() {
        UUID rootId = UUID.randomUUID();

        assertThrows(ValidationException.class, () -> service.linkToFlow(rootId, null));
        verifyNoInteractions(screenplayRepository, flowRepository);
    }

    @Test
    @DisplayName("Should treat unlinking an unlinked page as a no-op")
    void shouldIgnoreUnlinkWhenNotLinked() {
        UUID rootId = UUID.randomUUID();
        when(screenplayRepository.findById(rootId)).thenReturn(Optional.of(screenplay(rootId, null, null)));

        FlowLinkDto result = service.unlinkFlow(rootId);

        assertFalse(result.linked());
        verifyNoInteractions(elementRepository);
        verify(screenplayRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should stop loading child pages at the maximum tree depth")
    void shouldStopAtMaxTreeDepth() {
        properties.setMaxTreeDepth(1);
        UUID rootId = UUID.randomUUID();
        UUID childId = UUID.randomUUID();
        UUID grandchildId = UUID.randomUUID();
        Screenplay root = screenplay(rootId, null, null);
        when(screenplayRepository.findById(rootId)).thenReturn(Optional.of(root));
        when(screenplayRepository.findByParentIdOrderByPositionAsc(rootId))
                .thenReturn(List.of(screenplay(childId, rootId, null)));
        when(screenplayRepository.findByParentIdOrderByPositionAsc(childId))
                .thenReturn(List.of(screenplay(grandchildId, childId, null)));
        when(flowRepository.save(any(Flow.class))).thenAnswer(invocation -> {
            Flow flow = invocation.getArgument(0);
            flow.setId(UUID.randomUUID());
            return flow;
        });

        SyncReportDto report = service.syncToFlow(rootId);

        assertNotNull(report.flowId());
        assertEquals(report.flowId(), root.getLinkedFlowId());
        assertTrue(report.isNoop());
        verify(elementRepository).findByScreenplayIdOrderByPositionAsc(rootId);
        verify(elementRepository).findByScreenplayIdOrderByPositionAsc(childId);
        verify(elementRepository, never()).findByScreenplayIdOrderByPositionAsc(grandchildId);
    }
}
