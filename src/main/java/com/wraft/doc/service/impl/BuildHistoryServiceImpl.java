package com.wraft.doc.service.impl;

import com.google.common.base.Preconditions;
import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.BuildHistory;
import com.wraft.doc.model.Instance;
import com.wraft.doc.model.dto.BuildHistoryResponse;
import com.wraft.doc.repository.BuildHistoryRepository;
import com.wraft.doc.repository.InstanceRepository;
import com.wraft.doc.service.BuildHistoryParams;
import com.wraft.doc.service.BuildHistoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BuildHistoryServiceImpl implements BuildHistoryService {

    private final BuildHistoryRepository buildHistoryRepository;
    private final InstanceRepository instanceRepository;

    @Override
    @Transactional
    public BuildHistory addBuildHistory(String creatorId, Instance instance, BuildHistoryParams params) {
        Preconditions.checkNotNull(instance, "instance");
        Preconditions.checkNotNull(params.startTime(), "startTime");
        Preconditions.checkNotNull(params.endTime(), "endTime");

        long delay = Duration.between(params.startTime(), params.endTime()).toMillis();

        BuildHistory history = BuildHistory.builder()
                .content(instance)
                .creatorId(creatorId)
                .startTime(params.startTime())
                .endTime(params.endTime())
                .delay(delay)
                .exitCode(params.exitCode())
                .status(params.exitCode() == 0 ? BuildHistory.STATUS_SUCCESS : BuildHistory.STATUS_FAILED)
                .build();

        BuildHistory saved = buildHistoryRepository.saveAndFlush(history);
        log.info("Recorded build {} of {}: exit code {}, {}ms", saved.getId(), instance.getInstanceId(), saved.getExitCode(), delay);
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BuildHistory> latestSuccessful(Instance instance) {
        return buildHistoryRepository.findFirstByContentIdAndExitCodeOrderByInsertedAtDescIdDesc(instance.getId(), 0);
    }

    @Override
    @Transactional(readOnly = true)
    public List<BuildHistoryResponse> listForInstance(String instanceUuid) {
        Instance instance = instanceRepository.findByUuid(instanceUuid)
                .orElseThrow(() -> new DocumentNotFoundException("Instance", instanceUuid));

        return buildHistoryRepository.findByContentIdOrderByInsertedAtDescIdDesc(instance.getId()).stream()
                .map(BuildHistoryResponse::from)
                .toList();
    }
}
