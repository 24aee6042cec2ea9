package com.cityvibe.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Canonical in-pipeline representation of an event between normalization and persistence.
 *
 * Created by the normalizer, annotated by the validator (rejection reasons) and filled in
 * by the enricher. Once handed to the event store it is no longer modified.
 */
public class EventDraft {

    @JsonIgnore
    private int recordIndex;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("start_time")
    private Instant startTime;

    @JsonProperty("end_time")
    private Instant endTime;

    @JsonProperty("venue_id")
    private String venueId;

    @JsonProperty("source_url")
    private String sourceUrl;

    @JsonProperty("external_id")
    private String externalId;

    @JsonProperty("address")
    private String address;

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("longitude")
    private Double longitude;

    @JsonProperty("price_min")
    private BigDecimal priceMin;

    @JsonProperty("price_max")
    private BigDecimal priceMax;

    @JsonProperty("currency")
    private String currency;

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("sold_out")
    private Boolean soldOut;

    @JsonProperty("categories")
    private Set<String> categories;

    @JsonProperty("tags")
    private Set<String> tags;

    @JsonProperty("embedding")
    private float[] embedding;

    @JsonProperty("signature")
    private String signature;

    @JsonIgnore
    private final List<String> rejectionReasons;

    /**
     * Default constructor for Jackson deserialization
     */
    public EventDraft() {
        this.categories = new LinkedHashSet<>();
        this.tags = new LinkedHashSet<>();
        this.rejectionReasons = new ArrayList<>();
    }

    public EventDraft(int recordIndex) {
        this();
        this.recordIndex = recordIndex;
    }

    // Getters and Setters

    public int getRecordIndex() {
        return recordIndex;
    }

    public void setRecordIndex(int recordIndex) {
        this.recordIndex = recordIndex;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public String getVenueId() {
        return venueId;
    }

    public void setVenueId(String venueId) {
        this.venueId = venueId;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public String getExternalId() {
        return externalId;
    }

    public void setExternalId(String externalId) {
        this.externalId = externalId;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    public BigDecimal getPriceMin() {
        return priceMin;
    }

    public void setPriceMin(BigDecimal priceMin) {
        this.priceMin = priceMin;
    }

    public BigDecimal getPriceMax() {
        return priceMax;
    }

    public void setPriceMax(BigDecimal priceMax) {
        this.priceMax = priceMax;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Boolean getSoldOut() {
        return soldOut;
    }

    public void setSoldOut(Boolean soldOut) {
        this.soldOut = soldOut;
    }

    public Set<String> getCategories() {
        return categories;
    }

    public void setCategories(Collection<String> categories) {
        this.categories = categories != null ? new LinkedHashSet<>(categories) : new LinkedHashSet<>();
    }

    public Set<String> getTags() {
        return tags;
    }

    public void setTags(Collection<String> tags) {
        this.tags = tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>();
    }

    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public void setEmbedding(float[] embedding) {
        this.embedding = embedding != null ? embedding.clone() : null;
    }

    public String getSignature() {
        return signature;
    }

    public void setSignature(String signature) {
        this.signature = signature;
    }

    public List<String> getRejectionReasons() {
        return rejectionReasons;
    }

    /**
     * Attach a rejection reason; the draft stays in the batch until partitioning
     */
    public void addRejectionReason(String reason) {
        this.rejectionReasons.add(reason);
    }

    public boolean isRejected() {
        return !rejectionReasons.isEmpty();
    }

    /**
     * Independent copy of this draft; later changes to either side do not reach the other
     */
    public EventDraft copy() {
        EventDraft copy = new EventDraft(recordIndex);
        copy.title = title;
        copy.description = description;
        copy.startTime = startTime;
        copy.endTime = endTime;
        copy.venueId = venueId;
        copy.sourceUrl = sourceUrl;
        copy.externalId = externalId;
        copy.address = address;
        copy.latitude = latitude;
        copy.longitude = longitude;
        copy.priceMin = priceMin;
        copy.priceMax = priceMax;
        copy.currency = currency;
        copy.imageUrl = imageUrl;
        copy.soldOut = soldOut;
        copy.setCategories(categories);
        copy.setTags(tags);
        copy.setEmbedding(embedding);
        copy.signature = signature;
        copy.rejectionReasons.addAll(rejectionReasons);
        return copy;
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    @Override
    public String toString() {
        return "EventDraft{recordIndex=" + recordIndex
            + ", title='" + title + '\''
            + ", venueId='" + venueId + '\''
            + ", startTime=" + startTime
            + ", signature='" + signature + '\''
            + '}';
    }
}
