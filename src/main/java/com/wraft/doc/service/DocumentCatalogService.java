package com.wraft.doc.service;

import com.wraft.doc.model.Asset;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.Layout;
import com.wraft.doc.model.State;
import com.wraft.doc.model.dto.CreateAssetRequest;
import com.wraft.doc.model.dto.CreateContentTypeRequest;
import com.wraft.doc.model.dto.CreateLayoutRequest;
import com.wraft.doc.model.dto.CreateStateRequest;

/**
 * Setup of the records instances are built from: assets, layouts, content types and states.
 */
public interface DocumentCatalogService {

    Asset createAsset(CreateAssetRequest request);

    /**
     * Assets are looked up by uuid and associated in request order.
     */
    Layout createLayout(CreateLayoutRequest request);

    /**
     * Fields are stored in declaration order.
     */
    ContentType createContentType(CreateContentTypeRequest request);

    State createState(CreateStateRequest request);
}
