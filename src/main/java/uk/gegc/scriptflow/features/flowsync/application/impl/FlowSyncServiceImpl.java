package uk.gegc.scriptflow.features.flowsync.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.scriptflow.features.flow.domain.model.Flow;
import uk.gegc.scriptflow.features.flow.domain.model.FlowConnection;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNode;
import uk.gegc.scriptflow.features.flow.domain.model.NodeSource;
import uk.gegc.scriptflow.features.flow.domain.repository.FlowConnectionRepository;
import uk.gegc.scriptflow.features.flow.domain.repository.FlowNodeRepository;
import uk.gegc.scriptflow.features.flow.domain.repository.FlowRepository;
import uk.gegc.scriptflow.features.flowsync.api.dto.FlowLinkDto;
import uk.gegc.scriptflow.features.flowsync.api.dto.SyncReportDto;
import uk.gegc.scriptflow.features.flowsync.application.FlowLayout;
import uk.gegc.scriptflow.features.flowsync.application.FlowSyncService;
import uk.gegc.scriptflow.features.flowsync.application.FlowTraversal;
import uk.gegc.scriptflow.features.flowsync.application.PageTreeBuilder;
import uk.gegc.scriptflow.features.flowsync.config.FlowSyncProperties;
import uk.gegc.scriptflow.features.flowsync.domain.model.*;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ResponseChoiceCodec;
import uk.gegc.scriptflow.features.flowsync.infra.mapping.ReverseNodeMapper;
import uk.gegc.scriptflow.features.screenplay.domain.model.ElementType;
import uk.gegc.scriptflow.features.screenplay.domain.model.Screenplay;
import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;
import uk.gegc.scriptflow.features.screenplay.domain.repository.ScreenplayElementRepository;
import uk.gegc.scriptflow.features.screenplay.domain.repository.ScreenplayRepository;
import uk.gegc.scriptflow.shared.exception.NotLinkedException;
import uk.gegc.scriptflow.shared.exception.ResourceNotFoundException;
import uk.gegc.scriptflow.shared.exception.ValidationException;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class FlowSyncServiceImpl implements FlowSyncService {

    static final String UNTITLED_BRANCH = "Untitled Branch";

    private final ScreenplayRepository screenplayRepository;
    private final ScreenplayElementRepository elementRepository;
    private final FlowRepository flowRepository;
    private final FlowNodeRepository nodeRepository;
    private final FlowConnectionRepository connectionRepository;
    private final PageTreeBuilder pageTreeBuilder;
    private final FlowLayout flowLayout;
    private final FlowTraversal flowTraversal;
    private final ReverseNodeMapper reverseNodeMapper;
    private final FlowSyncProperties properties;

    @Override
    public FlowLinkDto ensureFlow(UUID screenplayId) {
        Screenplay screenplay = loadScreenplay(screenplayId);
        Flow flow = resolveOrCreateFlow(screenplay);
        return toLinkDto(screenplay, flow);
    }

    @Override
    public FlowLinkDto linkToFlow(UUID screenplayId, UUID flowId) {
        if (flowId == null) {
            throw new ValidationException("flowId is required to link screenplay " + screenplayId);
        }
        Screenplay screenplay = loadScreenplay(screenplayId);
        Flow flow = flowRepository.findById(flowId)
                .orElseThrow(() -> new ResourceNotFoundException("Flow " + flowId + " not found"));
        screenplay.setLinkedFlowId(flow.getId());
        screenplayRepository.save(screenplay);
        log.info("Linked screenplay {} to flow {}", screenplayId, flowId);
        return toLinkDto(screenplay, flow);
    }

    @Override
    public FlowLinkDto unlinkFlow(UUID screenplayId) {
        Screenplay screenplay = loadScreenplay(screenplayId);
        if (screenplay.getLinkedFlowId() == null) {
            return FlowLinkDto.unlinked(screenplayId);
        }

        Set<UUID> pageIds = new LinkedHashSet<>();
        collectPageIds(screenplayId, 0, pageIds);
        List<ScreenplayElement> linked = elementRepository.findByScreenplayIdInAndLinkedNodeIdIsNotNull(pageIds);
        linked.forEach(element -> element.setLinkedNodeId(null));

        UUID previousFlowId = screenplay.getLinkedFlowId();
        screenplay.setLinkedFlowId(null);
        screenplayRepository.save(screenplay);
        log.info("Unlinked screenplay {} from flow {} ({} pages, {} element links cleared)",
                screenplayId, previousFlowId, pageIds.size(), linked.size());
        return FlowLinkDto.unlinked(screenplayId);
    }

    @Override
    public SyncReportDto syncToFlow(UUID screenplayId) {
        Screenplay root = loadScreenplay(screenplayId);
        PageSnapshot snapshot = loadSnapshot(root.getId(), 0, new HashSet<>());
        PageTree tree = pageTreeBuilder.build(snapshot);
        FlatPageTree flat = pageTreeBuilder.flatten(tree);
        List<NodePosition> positions = flowLayout.computePositions(tree);

        Flow flow = resolveOrCreateFlow(root);
        SyncCounts counts = new SyncCounts();

        Map<UUID, ScreenplayElement> elementsById = new HashMap<>();
        collectElements(snapshot, elementsById);

        List<FlowNode> existingNodes = nodeRepository.findByFlowId(flow.getId());
        Map<UUID, FlowNode> managedById = existingNodes.stream()
                .filter(FlowNode::isManaged)
                .collect(Collectors.toMap(FlowNode::getId, Function.identity()));
        Map<UUID, FlowNode> manualById = existingNodes.stream()
                .filter(node -> !node.isManaged())
                .collect(Collectors.toMap(FlowNode::getId, Function.identity()));

        List<FlowNode> resultNodes = upsertNodes(
                flow, flat.nodeSpecs(), positions, elementsById, managedById, manualById, counts);
        Set<UUID> resultIds = resultNodes.stream().map(FlowNode::getId).collect(Collectors.toSet());

        List<FlowNode> orphans = managedById.values().stream()
                .filter(node -> !resultIds.contains(node.getId()))
                .toList();
        deleteOrphanNodes(flow.getId(), orphans, counts);

        reconcileConnections(flow.getId(), resultNodes, resultIds, flat.connections(), counts);
        stampElementLinks(flat.nodeSpecs(), resultNodes, elementsById, counts);

        SyncReportDto report = counts.toReport(root.getId(), flow.getId());
        log.info("Pushed screenplay {} ({} pages) to flow {}: nodes +{} ~{} -{}, connections +{} -{}",
                root.getId(), flat.screenplayIds().size(), flow.getId(),
                report.nodesCreated(), report.nodesUpdated(), report.nodesDeleted(),
                report.connectionsCreated(), report.connectionsDeleted());
        return report;
    }

    @Override
    public SyncReportDto syncFromFlow(UUID screenplayId) {
        Screenplay root = loadScreenplay(screenplayId);
        if (root.getLinkedFlowId() == null) {
            throw new NotLinkedException(screenplayId);
        }
        Flow flow = flowRepository.findById(root.getLinkedFlowId())
                .orElseThrow(() -> new ResourceNotFoundException("Flow " + root.getLinkedFlowId() + " not found"));

        List<FlowNode> nodes = nodeRepository.findByFlowId(flow.getId());
        List<FlowConnection> connections = connectionRepository.findByFlowId(flow.getId());
        TraversalTree tree = flowTraversal.linearizeTree(nodes, connections);

        SyncCounts counts = new SyncCounts();
        syncPageFromTree(root, tree, 0, counts);

        SyncReportDto report = counts.toReport(root.getId(), flow.getId());
        log.info("Pulled flow {} into screenplay {}: elements +{} ~{} -{}, pages +{}",
                flow.getId(), root.getId(),
                report.elementsCreated(), report.elementsUpdated(), report.elementsDeleted(), report.pagesCreated());
        return report;
    }

    private List<FlowNode> upsertNodes(Flow flow,
                                       List<NodeSpec> specs,
                                       List<NodePosition> positions,
                                       Map<UUID, ScreenplayElement> elementsById,
                                       Map<UUID, FlowNode> managedById,
                                       Map<UUID, FlowNode> manualById,
                                       SyncCounts counts) {
        Set<UUID> matched = new HashSet<>();
        List<FlowNode> result = new ArrayList<>(specs.size());
        for (int index = 0; index < specs.size(); index++) {
            NodeSpec spec = specs.get(index);
            FlowNode existing = findLinkedNode(spec, elementsById, managedById, matched);
            FlowNode manual = existing == null ? findLinkedNode(spec, elementsById, manualById, matched) : null;
            if (manual != null) {
                // Elements pulled from a hand-built node keep pointing at it; the node itself stays untouched.
                matched.add(manual.getId());
                log.debug("Kept manual node {} for its pulled elements", manual.getId());
                result.add(manual);
            } else if (existing != null) {
                matched.add(existing.getId());
                if (existing.getType() != spec.type() || !Objects.equals(existing.getData(), spec.data())) {
                    existing.setType(spec.type());
                    existing.setData(spec.data());
                    counts.nodesUpdated++;
                    log.debug("Updated synced node {} ({})", existing.getId(), spec.type().getValue());
                }
                result.add(existing);
            } else {
                NodePosition position = positions.get(index);
                FlowNode created = nodeRepository.save(new FlowNode(
                        flow.getId(), spec.type(), spec.data(), position.x(), position.y(), NodeSource.SCREENPLAY_SYNC));
                counts.nodesCreated++;
                log.debug("Created synced node {} ({}) at ({}, {})",
                        created.getId(), spec.type().getValue(), position.x(), position.y());
                result.add(created);
            }
        }
        return result;
    }

    private FlowNode findLinkedNode(NodeSpec spec,
                                    Map<UUID, ScreenplayElement> elementsById,
                                    Map<UUID, FlowNode> candidatesById,
                                    Set<UUID> matched) {
        for (UUID elementId : spec.elementIds()) {
            ScreenplayElement element = elementsById.get(elementId);
            if (element == null || element.getLinkedNodeId() == null) {
                continue;
            }
            FlowNode node = candidatesById.get(element.getLinkedNodeId());
            if (node != null && !matched.contains(node.getId())) {
                return node;
            }
        }
        return null;
    }

    private void deleteOrphanNodes(UUID flowId, List<FlowNode> orphans, SyncCounts counts) {
        if (orphans.isEmpty()) {
            return;
        }
        Set<UUID> orphanIds = orphans.stream().map(FlowNode::getId).collect(Collectors.toSet());

        List<FlowConnection> touching = connectionRepository.findByFlowId(flowId).stream()
                .filter(connection -> orphanIds.stream().anyMatch(connection::touches))
                .toList();
        connectionRepository.deleteAll(touching);
        counts.connectionsDeleted += touching.size();

        elementRepository.findByLinkedNodeIdIn(orphanIds).forEach(element -> element.setLinkedNodeId(null));

        nodeRepository.deleteAll(orphans);
        counts.nodesDeleted += orphans.size();
        log.debug("Deleted {} orphaned synced nodes from flow {}", orphans.size(), flowId);
    }

    private void reconcileConnections(UUID flowId,
                                      List<FlowNode> resultNodes,
                                      Set<UUID> resultIds,
                                      List<ConnectionSpec> specs,
                                      SyncCounts counts) {
        Set<ConnectionKey> desired = new LinkedHashSet<>();
        for (ConnectionSpec spec : specs) {
            desired.add(new ConnectionKey(
                    resultNodes.get(spec.sourceIndex()).getId(),
                    spec.sourcePin(),
                    resultNodes.get(spec.targetIndex()).getId(),
                    spec.targetPin()));
        }

        Set<UUID> manualIds = resultNodes.stream()
                .filter(node -> !node.isManaged())
                .map(FlowNode::getId)
                .collect(Collectors.toSet());

        Set<ConnectionKey> kept = new HashSet<>();
        List<FlowConnection> stale = new ArrayList<>();
        for (FlowConnection connection : connectionRepository.findByFlowId(flowId)) {
            if (!resultIds.contains(connection.getSourceNodeId()) || !resultIds.contains(connection.getTargetNodeId())) {
                continue;
            }
            ConnectionKey key = ConnectionKey.of(connection);
            if (desired.contains(key) && kept.add(key)) {
                continue;
            }
            if (manualIds.contains(connection.getSourceNodeId()) || manualIds.contains(connection.getTargetNodeId())) {
                continue;
            }
            stale.add(connection);
        }
        connectionRepository.deleteAll(stale);
        counts.connectionsDeleted += stale.size();

        for (ConnectionKey key : desired) {
            if (!kept.contains(key)) {
                connectionRepository.save(new FlowConnection(
                        flowId, key.sourceNodeId(), key.sourcePin(), key.targetNodeId(), key.targetPin()));
                counts.connectionsCreated++;
            }
        }
    }

    private void stampElementLinks(List<NodeSpec> specs,
                                   List<FlowNode> resultNodes,
                                   Map<UUID, ScreenplayElement> elementsById,
                                   SyncCounts counts) {
        for (int index = 0; index < specs.size(); index++) {
            UUID nodeId = resultNodes.get(index).getId();
            for (UUID elementId : specs.get(index).elementIds()) {
                ScreenplayElement element = elementsById.get(elementId);
                if (element != null && !nodeId.equals(element.getLinkedNodeId())) {
                    element.setLinkedNodeId(nodeId);
                    counts.elementUpdated(element);
                }
            }
        }
    }

    private PageSnapshot loadSnapshot(UUID screenplayId, int depth, Set<UUID> visited) {
        visited.add(screenplayId);
        List<ScreenplayElement> elements = elementRepository.findByScreenplayIdOrderByPositionAsc(screenplayId);
        List<PageSnapshot> children = new ArrayList<>();
        List<Screenplay> childPages = screenplayRepository.findByParentIdOrderByPositionAsc(screenplayId);
        if (depth >= properties.getMaxTreeDepth()) {
            if (!childPages.isEmpty()) {
                log.warn("Page {} is at the maximum tree depth {}; {} child pages not synchronized",
                        screenplayId, properties.getMaxTreeDepth(), childPages.size());
            }
        } else {
            for (Screenplay child : childPages) {
                if (!visited.contains(child.getId())) {
                    children.add(loadSnapshot(child.getId(), depth + 1, visited));
                }
            }
        }
        return new PageSnapshot(screenplayId, elements, children);
    }

    private void collectElements(PageSnapshot snapshot, Map<UUID, ScreenplayElement> elementsById) {
        snapshot.elements().forEach(element -> elementsById.put(element.getId(), element));
        snapshot.children().forEach(child -> collectElements(child, elementsById));
    }

    private void syncPageFromTree(Screenplay page, TraversalTree tree, int depth, SyncCounts counts) {
        if (depth > properties.getMaxTreeDepth()) {
            log.warn("Stopped pulling below page {}: maximum tree depth {} reached",
                    page.getId(), properties.getMaxTreeDepth());
            return;
        }

        Set<String> branchKeys = new HashSet<>();
        for (TraversalBranch branch : tree.branches()) {
            branchKeys.add(branchKey(branch.sourceNodeId(), branch.choiceId()));
        }

        List<ElementSpec> specs = reverseNodeMapper.toElementSpecs(tree.nodes()).stream()
                .map(spec -> withoutUnbranchedLinks(spec, branchKeys))
                .toList();
        List<ScreenplayElement> pageElements = syncPageElements(page, specs, branchKeys, counts);

        Map<UUID, FlowNode> nodesById = tree.nodes().stream()
                .collect(Collectors.toMap(FlowNode::getId, Function.identity()));
        for (TraversalBranch branch : tree.branches()) {
            FlowNode source = nodesById.get(branch.sourceNodeId());
            syncBranch(page, branch, source, pageElements, depth, counts);
        }
    }

    /**
     * Clears the link of every choice that has no outgoing connection in the flow. The child page
     * it pointed at is kept.
     */
    private ElementSpec withoutUnbranchedLinks(ElementSpec spec, Set<String> branchKeys) {
        if (spec.type() != ElementType.RESPONSE || spec.data() == null || !spec.data().isObject()) {
            return spec;
        }
        ObjectNode data = (ObjectNode) spec.data();
        for (JsonNode choice : ResponseChoiceCodec.choicesOf(data)) {
            if (!choice.isObject() || !choice.hasNonNull(ResponseChoiceCodec.ID)) {
                continue;
            }
            String choiceId = choice.get(ResponseChoiceCodec.ID).asText();
            if (!branchKeys.contains(branchKey(spec.sourceNodeId(), choiceId))
                    && ResponseChoiceCodec.linkedScreenplayId(choice).isPresent()) {
                data = ResponseChoiceCodec.withLinkedScreenplay(data, choiceId, null);
                log.debug("Cleared link of choice {} on node {}: no connection in flow", choiceId, spec.sourceNodeId());
            }
        }
        return data == spec.data() ? spec : new ElementSpec(spec.type(), spec.content(), data, spec.sourceNodeId());
    }

    private List<ScreenplayElement> syncPageElements(Screenplay page,
                                                     List<ElementSpec> specs,
                                                     Set<String> branchKeys,
                                                     SyncCounts counts) {
        List<ScreenplayElement> existing = elementRepository.findByScreenplayIdOrderByPositionAsc(page.getId());
        List<ScreenplayElement> mappeable = existing.stream()
                .filter(element -> !element.getType().isNonMappeable())
                .toList();
        Map<UUID, List<ScreenplayElement>> byNode = mappeable.stream()
                .filter(element -> element.getLinkedNodeId() != null)
                .collect(Collectors.groupingBy(ScreenplayElement::getLinkedNodeId, LinkedHashMap::new, Collectors.toList()));

        Set<UUID> used = new HashSet<>();
        Set<UUID> changed = new HashSet<>();
        List<ScreenplayElement> result = new ArrayList<>(specs.size());
        for (ElementSpec spec : specs) {
            ScreenplayElement match = byNode.getOrDefault(spec.sourceNodeId(), List.of()).stream()
                    .filter(element -> element.getType() == spec.type() && !used.contains(element.getId()))
                    .findFirst()
                    .orElse(null);
            if (match == null) {
                ScreenplayElement created = new ScreenplayElement(
                        page.getId(), spec.type(), contentOf(spec), spec.data(), result.size());
                created.setLinkedNodeId(spec.sourceNodeId());
                result.add(created);
                counts.elementsCreated++;
            } else {
                used.add(match.getId());
                if (applySpec(match, spec, branchKeys)) {
                    changed.add(match.getId());
                }
                result.add(match);
            }
        }

        List<ScreenplayElement> orphaned = mappeable.stream()
                .filter(element -> !used.contains(element.getId()))
                .toList();
        if (!orphaned.isEmpty()) {
            elementRepository.deleteAll(orphaned);
            counts.elementsDeleted += orphaned.size();
            log.debug("Deleted {} elements from page {} whose nodes left the flow", orphaned.size(), page.getId());
        }

        List<ScreenplayElement> ordered = insertNonMappeable(existing, result);
        for (int position = 0; position < ordered.size(); position++) {
            ScreenplayElement element = ordered.get(position);
            if (element.getId() == null) {
                element.setPosition(position);
                elementRepository.save(element);
                counts.elementCreated(element);
            } else if (!Objects.equals(element.getPosition(), position)) {
                element.setPosition(position);
                changed.add(element.getId());
            }
        }
        ordered.stream()
                .filter(element -> changed.contains(element.getId()))
                .forEach(counts::elementUpdated);
        return ordered;
    }

    private boolean applySpec(ScreenplayElement element, ElementSpec spec, Set<String> branchKeys) {
        JsonNode data = spec.type() == ElementType.RESPONSE
                ? mergeChoiceLinks(spec, element.getData(), branchKeys)
                : spec.data();
        String content = contentOf(spec);
        if (Objects.equals(element.getContent(), content) && Objects.equals(element.getData(), data)) {
            return false;
        }
        element.setContent(content);
        element.setData(data);
        return true;
    }

    // A choice link held on the page survives while its connection exists and the flow carries no link of its own.
    private JsonNode mergeChoiceLinks(ElementSpec spec, JsonNode current, Set<String> branchKeys) {
        JsonNode incoming = spec.data();
        if (incoming == null || !incoming.isObject()) {
            return incoming;
        }
        ObjectNode merged = ((ObjectNode) incoming).deepCopy();
        JsonNode choices = merged.get(ResponseChoiceCodec.CHOICES);
        if (choices == null || !choices.isArray()) {
            return merged;
        }
        for (JsonNode choice : choices) {
            if (!choice.isObject() || !choice.hasNonNull(ResponseChoiceCodec.ID)
                    || ResponseChoiceCodec.linkedScreenplayId(choice).isPresent()) {
                continue;
            }
            String choiceId = choice.get(ResponseChoiceCodec.ID).asText();
            if (!branchKeys.contains(branchKey(spec.sourceNodeId(), choiceId))) {
                continue;
            }
            ResponseChoiceCodec.findChoice(current, choiceId)
                    .flatMap(ResponseChoiceCodec::linkedScreenplayId)
                    .ifPresent(linked -> ((ObjectNode) choice).put(ResponseChoiceCodec.LINKED_SCREENPLAY_ID, linked.toString()));
        }
        return merged;
    }

    /**
     * Places each writer-only element before the first later mapped element that is still on the
     * page, matched by element id or by the node it is linked to. Without such an anchor it moves
     * to the end.
     */
    private List<ScreenplayElement> insertNonMappeable(List<ScreenplayElement> existing, List<ScreenplayElement> result) {
        Set<UUID> resultIds = new HashSet<>();
        Set<UUID> resultNodeIds = new HashSet<>();
        for (ScreenplayElement element : result) {
            if (element.getId() != null) {
                resultIds.add(element.getId());
            }
            if (element.getLinkedNodeId() != null) {
                resultNodeIds.add(element.getLinkedNodeId());
            }
        }

        Map<UUID, List<ScreenplayElement>> byElementAnchor = new HashMap<>();
        Map<UUID, List<ScreenplayElement>> byNodeAnchor = new HashMap<>();
        List<ScreenplayElement> tail = new ArrayList<>();
        for (int index = 0; index < existing.size(); index++) {
            ScreenplayElement element = existing.get(index);
            if (!element.getType().isNonMappeable()) {
                continue;
            }
            boolean anchored = false;
            for (int later = index + 1; later < existing.size() && !anchored; later++) {
                ScreenplayElement candidate = existing.get(later);
                if (candidate.getType().isNonMappeable()) {
                    continue;
                }
                if (resultIds.contains(candidate.getId())) {
                    byElementAnchor.computeIfAbsent(candidate.getId(), id -> new ArrayList<>()).add(element);
                    anchored = true;
                } else if (candidate.getLinkedNodeId() != null && resultNodeIds.contains(candidate.getLinkedNodeId())) {
                    byNodeAnchor.computeIfAbsent(candidate.getLinkedNodeId(), id -> new ArrayList<>()).add(element);
                    anchored = true;
                }
            }
            if (!anchored) {
                tail.add(element);
            }
        }

        List<ScreenplayElement> ordered = new ArrayList<>(existing.size() + result.size());
        for (ScreenplayElement element : result) {
            if (element.getLinkedNodeId() != null) {
                List<ScreenplayElement> viaNode = byNodeAnchor.remove(element.getLinkedNodeId());
                if (viaNode != null) {
                    ordered.addAll(viaNode);
                }
            }
            if (element.getId() != null) {
                List<ScreenplayElement> viaElement = byElementAnchor.remove(element.getId());
                if (viaElement != null) {
                    ordered.addAll(viaElement);
                }
            }
            ordered.add(element);
        }
        ordered.addAll(tail);
        return ordered;
    }

    private void syncBranch(Screenplay parent,
                            TraversalBranch branch,
                            FlowNode source,
                            List<ScreenplayElement> pageElements,
                            int depth,
                            SyncCounts counts) {
        ScreenplayElement response = findResponseElement(pageElements, branch.sourceNodeId());
        Optional<UUID> linkedId = response != null
                ? ResponseChoiceCodec.findChoice(response.getData(), branch.choiceId())
                        .flatMap(ResponseChoiceCodec::linkedScreenplayId)
                : Optional.empty();
        if (linkedId.isEmpty() && source != null && source.getData() != null) {
            linkedId = ResponseChoiceCodec.findChoice(source.getData().get("responses"), branch.choiceId())
                    .flatMap(ResponseChoiceCodec::linkedScreenplayId);
        }

        Screenplay child = null;
        if (linkedId.isPresent()) {
            if (screenplayRepository.existsByIdAndParentId(linkedId.get(), parent.getId())) {
                child = screenplayRepository.findById(linkedId.get()).orElse(null);
            } else {
                log.warn("Choice {} on page {} links missing child page {}; creating a new branch page",
                        branch.choiceId(), parent.getId(), linkedId.get());
            }
        }
        if (child == null) {
            child = createBranchPage(parent, branch.choiceId(), source, counts);
            if (response != null) {
                response.setData(ResponseChoiceCodec.withLinkedScreenplay(response.getData(), branch.choiceId(), child.getId()));
                counts.elementUpdated(response);
            }
        } else if (response != null) {
            UUID childId = child.getId();
            boolean alreadyLinked = ResponseChoiceCodec.findChoice(response.getData(), branch.choiceId())
                    .flatMap(ResponseChoiceCodec::linkedScreenplayId)
                    .filter(childId::equals)
                    .isPresent();
            if (!alreadyLinked) {
                response.setData(ResponseChoiceCodec.withLinkedScreenplay(response.getData(), branch.choiceId(), childId));
                counts.elementUpdated(response);
            }
        }

        syncPageFromTree(child, branch.subtree(), depth + 1, counts);
    }

    private Screenplay createBranchPage(Screenplay parent, String choiceId, FlowNode source, SyncCounts counts) {
        String text = source != null && source.getData() != null
                ? ResponseChoiceCodec.findChoice(source.getData().get("responses"), choiceId)
                        .map(choice -> choice.path(ResponseChoiceCodec.TEXT).asText(""))
                        .orElse("")
                : "";
        Screenplay child = new Screenplay();
        child.setName(text.isBlank() ? UNTITLED_BRANCH : text);
        child.setParentId(parent.getId());
        child.setPosition(screenplayRepository.findMaxChildPosition(parent.getId()) + 1);
        Screenplay saved = screenplayRepository.save(child);
        counts.pagesCreated++;
        log.debug("Created branch page {} '{}' under {} for choice {}", saved.getId(), saved.getName(), parent.getId(), choiceId);
        return saved;
    }

    private ScreenplayElement findResponseElement(List<ScreenplayElement> pageElements, UUID nodeId) {
        return pageElements.stream()
                .filter(element -> element.getType() == ElementType.RESPONSE && nodeId.equals(element.getLinkedNodeId()))
                .findFirst()
                .orElse(null);
    }

    private static String branchKey(UUID nodeId, String choiceId) {
        return nodeId + ":" + choiceId;
    }

    private static String contentOf(ElementSpec spec) {
        return spec.content() != null ? spec.content() : "";
    }

    private Screenplay loadScreenplay(UUID screenplayId) {
        return screenplayRepository.findById(screenplayId)
                .orElseThrow(() -> new ResourceNotFoundException("Screenplay " + screenplayId + " not found"));
    }

    private Flow resolveOrCreateFlow(Screenplay screenplay) {
        if (screenplay.getLinkedFlowId() != null) {
            return flowRepository.findById(screenplay.getLinkedFlowId())
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Flow " + screenplay.getLinkedFlowId() + " linked to screenplay " + screenplay.getId() + " not found"));
        }
        Flow flow = flowRepository.save(new Flow(screenplay.getName()));
        screenplay.setLinkedFlowId(flow.getId());
        screenplayRepository.save(screenplay);
        log.info("Created flow {} for screenplay {}", flow.getId(), screenplay.getId());
        return flow;
    }

    private void collectPageIds(UUID screenplayId, int depth, Set<UUID> pageIds) {
        if (!pageIds.add(screenplayId) || depth >= properties.getMaxTreeDepth()) {
            return;
        }
        for (Screenplay child : screenplayRepository.findByParentIdOrderByPositionAsc(screenplayId)) {
            collectPageIds(child.getId(), depth + 1, pageIds);
        }
    }

    private FlowLinkDto toLinkDto(Screenplay screenplay, Flow flow) {
        return new FlowLinkDto(screenplay.getId(), flow.getId(), flow.getName(), true);
    }

    private record ConnectionKey(UUID sourceNodeId, String sourcePin, UUID targetNodeId, String targetPin) {

        private static ConnectionKey of(FlowConnection connection) {
            return new ConnectionKey(connection.getSourceNodeId(), connection.getSourcePin(),
                    connection.getTargetNodeId(), connection.getTargetPin());
        }
    }

    private static final class SyncCounts {
        private int nodesCreated;
        private int nodesUpdated;
        private int nodesDeleted;
        private int connectionsCreated;
        private int connectionsDeleted;
        private int elementsCreated;
        private int elementsDeleted;
        private int pagesCreated;
        private final Set<UUID> createdElementIds = new HashSet<>();
        private final Set<UUID> updatedElementIds = new HashSet<>();

        private void elementCreated(ScreenplayElement element) {
            if (element.getId() != null) {
                createdElementIds.add(element.getId());
            }
        }

        // Each element counts once per run, and never when this run created it.
        private void elementUpdated(ScreenplayElement element) {
            if (element.getId() != null && !createdElementIds.contains(element.getId())) {
                updatedElementIds.add(element.getId());
            }
        }

        private SyncReportDto toReport(UUID screenplayId, UUID flowId) {
            return new SyncReportDto(screenplayId, flowId,
                    nodesCreated, nodesUpdated, nodesDeleted,
                    connectionsCreated, connectionsDeleted,
                    elementsCreated, updatedElementIds.size(), elementsDeleted,
                    pagesCreated);
        }
    }
}
