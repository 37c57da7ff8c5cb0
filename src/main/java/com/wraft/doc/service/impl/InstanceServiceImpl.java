package com.wraft.doc.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.wraft.doc.build.BuildWorkspace;
import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.Instance;
import com.wraft.doc.model.State;
import com.wraft.doc.model.dto.CreateInstanceRequest;
import com.wraft.doc.model.dto.InstanceResponse;
import com.wraft.doc.model.dto.UpdateInstanceRequest;
import com.wraft.doc.repository.ContentTypeRepository;
import com.wraft.doc.repository.InstanceRepository;
import com.wraft.doc.repository.StateRepository;
import com.wraft.doc.service.BuildHistoryService;
import com.wraft.doc.service.CounterService;
import com.wraft.doc.service.InstanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Implementation of InstanceService.
 *
 * Creation must not run inside a transaction: the instance is inserted in the
 * counter's own transaction, which waits on other creators of the same content type.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InstanceServiceImpl implements InstanceService {

    private static final String CODE_FORMAT = "%s%04d";

    private final InstanceRepository instanceRepository;
    private final ContentTypeRepository contentTypeRepository;
    private final StateRepository stateRepository;
    private final BuildHistoryService buildHistoryService;
    private final CounterService counterService;

    @Override
    public InstanceResponse createInstance(String creatorId, String contentTypeUuid, CreateInstanceRequest request) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(creatorId), "Creator is required");

        ContentType contentType = contentTypeRepository.findByUuid(contentTypeUuid)
                .orElseThrow(() -> new DocumentNotFoundException("Content type", contentTypeUuid));
        State state = Strings.isNullOrEmpty(request.getStateUuid()) ? null : findState(request.getStateUuid());

        Instance saved = counterService.next(contentType, sequence -> instanceRepository.saveAndFlush(Instance.builder()
                .uuid(UUID.randomUUID().toString())
                .instanceId(String.format(CODE_FORMAT, contentType.getPrefix(), sequence))
                .raw(request.getRaw())
                .serialized(request.getSerialized() != null
                        ? new LinkedHashMap<>(request.getSerialized())
                        : new LinkedHashMap<>())
                .contentType(contentType)
                .state(state)
                .creatorId(creatorId)
                .build()));
        log.info("Created instance {} ({}) of content type {}", saved.getInstanceId(), saved.getUuid(), contentType.getName());

        // A fresh instance has never been built
        return InstanceResponse.from(saved, null);
    }

    @Override
    @Transactional(readOnly = true)
    public InstanceResponse showInstance(String uuid) {
        return toResponse(findInstance(uuid));
    }

    @Override
    @Transactional
    public InstanceResponse updateInstance(String uuid, UpdateInstanceRequest request) {
        Instance instance = findInstance(uuid);

        if (request.getRaw() != null) {
            instance.setRaw(request.getRaw());
        }
        if (request.getSerialized() != null) {
            instance.setSerialized(new LinkedHashMap<>(request.getSerialized()));
        }
        if (!Strings.isNullOrEmpty(request.getStateUuid())) {
            State state = findState(request.getStateUuid());
            log.info("Instance {} moves to state {}", instance.getInstanceId(), state.getState());
            instance.setState(state);
        }

        return toResponse(instanceRepository.saveAndFlush(instance));
    }

    @Override
    @Transactional
    public void deleteInstance(String uuid) {
        Instance instance = findInstance(uuid);
        instanceRepository.delete(instance);
        log.info("Deleted instance {} ({})", instance.getInstanceId(), uuid);
    }

    @Override
    @Transactional(readOnly = true)
    public List<InstanceResponse> listInstances(String contentTypeUuid) {
        if (contentTypeRepository.findByUuid(contentTypeUuid).isEmpty()) {
            throw new DocumentNotFoundException("Content type", contentTypeUuid);
        }
        return instanceRepository.findByContentTypeUuid(contentTypeUuid).stream()
                .map(this::toResponse)
                .toList();
    }

    private InstanceResponse toResponse(Instance instance) {
        String documentUrl = buildHistoryService.latestSuccessful(instance)
                .map(history -> BuildWorkspace.documentUrl(instance.getInstanceId()))
                .orElse(null);
        return InstanceResponse.from(instance, documentUrl);
    }

    private Instance findInstance(String uuid) {
        return instanceRepository.findByUuid(uuid)
                .orElseThrow(() -> new DocumentNotFoundException("Instance", uuid));
    }

    private State findState(String uuid) {
        return stateRepository.findByUuid(uuid)
                .orElseThrow(() -> new DocumentNotFoundException("State", uuid));
    }
}
