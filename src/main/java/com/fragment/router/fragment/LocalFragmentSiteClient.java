package com.fragment.router.fragment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fragment.router.core.model.Site;
import com.fragment.router.site.FragmentSiteClient;
import com.fragment.router.site.SiteErrorException;
import com.fragment.router.site.SiteRequest;
import com.fragment.router.site.SiteResponse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * In-process {@link FragmentSiteClient} backed directly by a {@link FragmentSite}.
 * Answers are serialized to JSON exactly as the HTTP surface would return them.
 */
public class LocalFragmentSiteClient implements FragmentSiteClient {

    private final FragmentSite fragmentSite;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public LocalFragmentSiteClient(FragmentSite fragmentSite) {
        this(fragmentSite, new ObjectMapper(), ForkJoinPool.commonPool());
    }

    public LocalFragmentSiteClient(FragmentSite fragmentSite, ObjectMapper objectMapper, Executor executor) {
        this.fragmentSite = fragmentSite;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public Site getSite() {
        return fragmentSite.getSite();
    }

    @Override
    public CompletableFuture<SiteResponse> fetch(SiteRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                String body = objectMapper.writeValueAsString(fragmentSite.answer(request));
                return new SiteResponse(getSite(), 200, body);
            } catch (JsonProcessingException e) {
                throw new SiteErrorException(getSite(), 500,
                        "Site " + getSite().getId() + " could not serialize its answer", e);
            }
        }, executor);
    }
}
