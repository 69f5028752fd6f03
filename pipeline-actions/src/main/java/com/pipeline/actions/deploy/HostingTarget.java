package com.pipeline.actions.deploy;

import com.pipeline.core.model.Blob;

/**
 * Static-file hosting that serves a published directory snapshot.
 */
public interface HostingTarget {

    /**
     * Replace the content served for an environment.
     * 
     * @param environment The environment name
     * @param content The directory snapshot to serve
     * @return Public URL of the published content
     */
    String publish(String environment, Blob content);
}
