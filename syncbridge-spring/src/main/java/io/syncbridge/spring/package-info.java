/**
 * Spring transaction integration: {@link io.syncbridge.spring.SpringTxContext} lets change
 * capture join {@code @Transactional} methods.
 */
package io.syncbridge.spring;
