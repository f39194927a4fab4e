package org.openfda.maude.bulkload.http;

public record HttpResponse(int statusCode, String statusText, String body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    @Override
    public String toString() {
        return "HttpResponse{statusCode=" + statusCode + ", statusText='" + statusText + "'}";
    }
}
