package com.shoprtc.core.msg;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of a product attached to a message sent from a product inquiry.
 * Never refreshed after the message is written.
 */
@Value
@Builder(toBuilder = true)
public class ProductSnapshot {
    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("image")
    String image;

    @JsonProperty("price")
    String price;

    @JsonCreator
    public ProductSnapshot(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("image") String image,
        @JsonProperty("price") String price
    ) {
        this.id = id;
        this.name = name;
        this.image = image;
        this.price = price;
    }
}
