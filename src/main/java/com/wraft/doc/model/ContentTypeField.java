package com.wraft.doc.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "content_type_fields")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentTypeField {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Key under which the value is found in an instance's serialized map.
     */
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * Examples: "String", "Date", "Text"
     */
    @Column(name = "field_type", nullable = false, length = 50)
    private String fieldType;

    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "content_type_id", nullable = false)
    private ContentType contentType;
}
