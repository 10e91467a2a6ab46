package com.mimecast.xoauth2.http;

import org.apache.commons.lang3.tuple.Triple;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Curl transport mock for testing.
 */
public class CurlTokenTransportMock extends CurlTokenTransport {

    private final Triple<Integer, byte[], String> result;

    private List<String> command;
    private String stdin;

    public CurlTokenTransportMock(Triple<Integer, byte[], String> result) {
        super("/opt/curl/bin/curl");
        this.result = result;
    }

    @Override
    protected Triple<Integer, byte[], String> runCurl(List<String> command, byte[] stdin) {
        this.command = command;
        this.stdin = new String(stdin, StandardCharsets.UTF_8);
        return result;
    }

    public List<String> getCommand() {
        return command;
    }

    public String getStdin() {
        return stdin;
    }
}
