package com.nearbyproducts.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Place metadata attached to a product under {@code meta.location.details}.
 * Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationDetails {
    private Double latitude;
    private Double longitude;

    @JsonProperty("google_place_id")
    private String googlePlaceId;

    @JsonProperty("formatted_address")
    private String formattedAddress;

    @JsonProperty("location_photo")
    private String locationPhotoId;

    @JsonProperty("style_name")
    private String styleName;

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

    public String getGooglePlaceId() {
        return googlePlaceId;
    }

    public void setGooglePlaceId(String googlePlaceId) {
        this.googlePlaceId = googlePlaceId;
    }

    public String getFormattedAddress() {
        return formattedAddress;
    }

    public void setFormattedAddress(String formattedAddress) {
        this.formattedAddress = formattedAddress;
    }

    public String getLocationPhotoId() {
        return locationPhotoId;
    }

    public void setLocationPhotoId(String locationPhotoId) {
        this.locationPhotoId = locationPhotoId;
    }

    public String getStyleName() {
        return styleName;
    }

    public void setStyleName(String styleName) {
        this.styleName = styleName;
    }
}
