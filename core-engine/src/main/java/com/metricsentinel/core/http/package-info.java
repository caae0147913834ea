/**
 * OkHttp and Jackson plumbing shared by the HTTP collaborator clients.
 */
package com.metricsentinel.core.http;
