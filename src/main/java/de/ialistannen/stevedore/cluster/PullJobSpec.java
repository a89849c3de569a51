package de.ialistannen.stevedore.cluster;

import java.util.Map;

/**
 * A job pulling an image onto every node matching a selector.
 *
 * @param name the name of the job. Equal to the name of the target it pulls for.
 * @param imageUrl the image to pull
 * @param nodeSelector the labels a node must have to receive the image
 */
public record PullJobSpec(String name, String imageUrl, Map<String, String> nodeSelector) {

}
