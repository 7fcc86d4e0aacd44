package com.sandy.esl.tracker.entity;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A price-tag record printed on an electronic shelf label.
 * Property names on the wire and in the {@code esl} table are the historical French ones.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class EslRecord {
    private EslType type;
    /** Serial number of the device the label belongs to. */
    private String serial;

    @Setter(AccessLevel.NONE)
    @JsonProperty("printed")
    private boolean printed;

    /** Backend-assigned identifier, null until the record is saved. */
    @Setter(AccessLevel.NONE)
    @JsonProperty("objectId")
    private String identity;

    /** Random token for Hanshow labels, barcode for Pricer labels. */
    @JsonProperty("eslId")
    private String labelId;
    /** Pricer only. */
    private String itemId;

    @JsonProperty("nom")
    private String name;
    @JsonProperty("nomScientifique")
    private String scientificName;
    @JsonProperty("prix")
    private String price;
    @JsonProperty("infosPrix")
    private String priceInfo;
    @JsonProperty("engin")
    private String fishingGear;
    private String zone;
    private String zoneCode;
    @JsonProperty("sousZone")
    private String subZone;
    @JsonProperty("sousZoneCode")
    private String subZoneCode;
    private String plu;
    @JsonProperty("taille")
    private String size;
    @JsonProperty("congelInfos")
    private String freezingInfo;
    @JsonProperty("origine")
    private String origin;
    @JsonProperty("allergenes")
    private String allergens;
    private String label;
    // peche / eleve / peche eau douce ...
    @JsonProperty("production")
    private String productionMethod;
    @JsonProperty("tva")
    private String vatRate;
    @JsonProperty("codeCategorie")
    private String categoryCode;
    @JsonProperty("prixAchat")
    private String purchasePrice;

    @Setter(AccessLevel.NONE)
    @JsonProperty("createdAt")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
    private LocalDateTime createdAt;

    /**
     * Attaches the identity and creation time handed back by a backend on save.
     *
     * @throws IllegalStateException if the record already carries an identity
     */
    public void assignIdentity(String identity, LocalDateTime createdAt) {
        if (this.identity != null) {
            throw new IllegalStateException("Record already has objectId " + this.identity);
        }
        this.identity = identity;
        this.createdAt = createdAt;
    }

    /** One-way transition, there is no way back to unprinted. */
    public void markPrinted() {
        this.printed = true;
    }

    public boolean hasIdentity() {
        return identity != null && !identity.isBlank();
    }
}
