package com.toolgate.lockdown;

/**
 * Access facts for one (actor, repository) pair.
 *
 * @param isPrivate     whether the repository is private
 * @param hasPushAccess whether the actor holds WRITE, MAINTAIN or ADMIN on it
 * @param viewerLogin   login of the identity that ran the query
 */
public record RepoAccessInfo(boolean isPrivate, boolean hasPushAccess, String viewerLogin) {
}
