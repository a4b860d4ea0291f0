/**
 * MongoDB implementation of the gateway's document store.
 *
 * {@link com.vibeflows.dataserver.repositories.mongo.MongoStore} owns the connection
 * and index bootstrap, {@link com.vibeflows.dataserver.repositories.mongo.MongoDocumentStore}
 * the generic CRUD and retention sweep, and
 * {@link com.vibeflows.dataserver.repositories.mongo.MongoTeamResolver} the membership
 * lookups behind per-tenant visibility.
 */
package com.vibeflows.dataserver.repositories.mongo;
