package com.tarterware.infrafinder.models;

import lombok.Value;

@Value
public class ErrorResponse
{
    String error;
    String message;
}
