package com.butlergroceries.retailer.service;

public class RetailerNotConfiguredException extends RuntimeException {
    public RetailerNotConfiguredException() {
        super("Retailer not configured; save a token first");
    }
}
