package com.gameday.leaguedata.service;

import com.gameday.leaguedata.exception.ResourceFetchException;

/** Reads a sheet's text in a single attempt. */
public interface ResourceFetcher {

    /**
     * @param location an http(s) URL, a {@code file:} URI or a filesystem path
     * @throws ResourceFetchException when the resource cannot be read
     */
    String fetch(String location);
}
