package com.wraft.doc.service.impl;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.wraft.doc.exception.DocumentNotFoundException;
import com.wraft.doc.model.Asset;
import com.wraft.doc.model.ContentType;
import com.wraft.doc.model.ContentTypeField;
import com.wraft.doc.model.Layout;
import com.wraft.doc.model.State;
import com.wraft.doc.model.dto.CreateAssetRequest;
import com.wraft.doc.model.dto.CreateContentTypeRequest;
import com.wraft.doc.model.dto.CreateLayoutRequest;
import com.wraft.doc.model.dto.CreateStateRequest;
import com.wraft.doc.repository.AssetRepository;
import com.wraft.doc.repository.ContentTypeRepository;
import com.wraft.doc.repository.LayoutRepository;
import com.wraft.doc.repository.StateRepository;
import com.wraft.doc.service.DocumentCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class DocumentCatalogServiceImpl implements DocumentCatalogService {

    private final AssetRepository assetRepository;
    private final LayoutRepository layoutRepository;
    private final ContentTypeRepository contentTypeRepository;
    private final StateRepository stateRepository;

    @Override
    public Asset createAsset(CreateAssetRequest request) {
        requireText(request.getName(), "Asset name");
        requireText(request.getCreatorId(), "Creator");

        Asset asset = assetRepository.save(Asset.builder()
                .uuid(newUuid())
                .name(request.getName())
                .file(request.getFile())
                .creatorId(request.getCreatorId())
                .build());

        log.info("Created asset {} ({})", asset.getName(), asset.getUuid());
        return asset;
    }

    @Override
    public Layout createLayout(CreateLayoutRequest request) {
        requireText(request.getName(), "Layout name");
        requireText(request.getSlug(), "Layout slug");
        requireText(request.getCreatorId(), "Creator");

        Layout layout = Layout.builder()
                .uuid(newUuid())
                .name(request.getName())
                .slug(request.getSlug())
                .description(request.getDescription())
                .creatorId(request.getCreatorId())
                .build();

        List<String> assetUuids = request.getAssetUuids() != null ? request.getAssetUuids() : List.of();
        for (String assetUuid : assetUuids) {
            layout.getAssets().add(assetRepository.findByUuid(assetUuid)
                    .orElseThrow(() -> new DocumentNotFoundException("Asset", assetUuid)));
        }

        Layout saved = layoutRepository.save(layout);
        log.info("Created layout {} (slug {}, {} assets)", saved.getName(), saved.getSlug(), assetUuids.size());
        return saved;
    }

    @Override
    public ContentType createContentType(CreateContentTypeRequest request) {
        requireText(request.getName(), "Content type name");
        requireText(request.getPrefix(), "Content type prefix");
        requireText(request.getCreatorId(), "Creator");

        Layout layout = Strings.isNullOrEmpty(request.getLayoutUuid()) ? null
                : layoutRepository.findByUuid(request.getLayoutUuid())
                        .orElseThrow(() -> new DocumentNotFoundException("Layout", request.getLayoutUuid()));

        ContentType contentType = ContentType.builder()
                .uuid(newUuid())
                .name(request.getName())
                .description(request.getDescription())
                .prefix(request.getPrefix())
                .color(request.getColor())
                .layout(layout)
                .creatorId(request.getCreatorId())
                .build();

        if (request.getFields() != null) {
            for (CreateContentTypeRequest.FieldDefinition definition : request.getFields()) {
                requireText(definition.getName(), "Field name");
                contentType.addField(ContentTypeField.builder()
                        .name(definition.getName())
                        .fieldType(Strings.isNullOrEmpty(definition.getFieldType()) ? "String" : definition.getFieldType())
                        .build());
            }
        }

        ContentType saved = contentTypeRepository.save(contentType);
        log.info("Created content type {} (prefix {}, {} fields)", saved.getName(), saved.getPrefix(), saved.getFields().size());
        return saved;
    }

    @Override
    public State createState(CreateStateRequest request) {
        requireText(request.getState(), "State name");

        return stateRepository.save(State.builder()
                .uuid(newUuid())
                .state(request.getState())
                .orderIndex(request.getOrderIndex())
                .build());
    }

    private static void requireText(String value, String what) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(value), "%s is required", what);
    }

    private static String newUuid() {
        return UUID.randomUUID().toString();
    }
}
