package com.al.pricetransparency.service.persistence;

import lombok.Value;

@Value
public class CollectionStats {
    long hospitals;
    long charges;
    long modifiers;
}
