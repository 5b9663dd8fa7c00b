package com.walletcustody.domain;

public enum TransferAsset {
    NATIVE,
    TOKEN
}
