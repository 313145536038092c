/**
 * Domain layer: pipeline data model and the execution ledger repository.
 */
package com.example.contentpipeline.domain;
