package com.wraft.doc.service;

import com.wraft.doc.model.dto.CreateInstanceRequest;
import com.wraft.doc.model.dto.InstanceResponse;
import com.wraft.doc.model.dto.UpdateInstanceRequest;

import java.util.List;

/**
 * Lifecycle of content instances.
 */
public interface InstanceService {

    /**
     * Create an instance and assign its sequence code (content type prefix plus
     * the next counter value, zero padded to four digits).
     */
    InstanceResponse createInstance(String creatorId, String contentTypeUuid, CreateInstanceRequest request);

    /**
     * Instance view; carries the document URL once a build has succeeded.
     */
    InstanceResponse showInstance(String uuid);

    InstanceResponse updateInstance(String uuid, UpdateInstanceRequest request);

    /**
     * Delete an instance together with its build log.
     */
    void deleteInstance(String uuid);

    /**
     * Instances of a content type, newest first.
     */
    List<InstanceResponse> listInstances(String contentTypeUuid);
}
